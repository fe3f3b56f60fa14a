package reportflow.engine.notify;

import reportflow.engine.model.Job;
import reportflow.engine.model.NotificationChannel;
import reportflow.engine.model.NotificationRecord;
import reportflow.engine.model.NotificationStatus;
import reportflow.engine.model.Run;
import reportflow.engine.repository.NotificationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.UUID;

/**
 * Log-channel notifier: writes the message to the application log and appends
 * a {@link NotificationRecord} to the notification store.
 */
public class LogNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LogNotifier.class);

    private final NotificationRepository notifications;
    private final Clock clock;

    public LogNotifier(NotificationRepository notifications, Clock clock) {
        this.notifications = notifications;
        this.clock = clock;
    }

    @Override
    public NotificationRecord notify(Job job, Run run) {
        String message = message(job, run);

        NotificationRecord record = new NotificationRecord(
                "ntf-" + UUID.randomUUID(),
                run.id(),
                NotificationChannel.LOG,
                NotificationStatus.SENT,
                run.state(),
                message,
                clock.instant());

        notifications.append(record);

        switch (run.state()) {
            case FAILED -> log.warn("[notify] {}", message);
            default -> log.info("[notify] {}", message);
        }
        return record;
    }

    static String message(Job job, Run run) {
        return switch (run.state()) {
            case SUCCESS -> "Report '" + job.name() + "' completed successfully. "
                    + "Rows exported: " + run.rowCount() + ". "
                    + "Output: " + run.artifactPath();
            case FAILED -> "Report '" + job.name() + "' failed. Error: " + run.error();
            default -> "Report '" + job.name() + "' status: " + run.state();
        };
    }
}
