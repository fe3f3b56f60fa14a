package reportflow.engine.model;

/**
 * Where a notification was delivered.
 */
public enum NotificationChannel {
    LOG
}
