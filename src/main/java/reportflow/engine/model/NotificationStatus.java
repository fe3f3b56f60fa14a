package reportflow.engine.model;

/**
 * Delivery outcome of a notification.
 */
public enum NotificationStatus {
    SENT,
    FAILED
}
