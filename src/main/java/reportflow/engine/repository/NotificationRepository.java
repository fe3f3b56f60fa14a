package reportflow.engine.repository;

import reportflow.engine.model.NotificationRecord;

import java.util.List;

/**
 * Append-only log of notifications.
 */
public interface NotificationRepository {

    void append(NotificationRecord record);

    List<NotificationRecord> findByRunId(String runId);
}
