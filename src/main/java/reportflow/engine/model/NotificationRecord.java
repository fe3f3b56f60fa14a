package reportflow.engine.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Append-only record of a terminal-state notification for one run.
 */
public record NotificationRecord(
        String id,
        String runId,
        NotificationChannel channel,
        NotificationStatus status,
        RunState runState,
        String message,
        Instant sentAt) {

    public NotificationRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(runId, "runId is required");
        Objects.requireNonNull(channel, "channel is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(runState, "runState is required");
        Objects.requireNonNull(sentAt, "sentAt is required");
    }
}
