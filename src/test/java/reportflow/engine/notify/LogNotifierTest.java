package reportflow.engine.notify;

import reportflow.engine.model.Job;
import reportflow.engine.model.NotificationChannel;
import reportflow.engine.model.NotificationRecord;
import reportflow.engine.model.NotificationStatus;
import reportflow.engine.model.Run;
import reportflow.engine.model.RunState;
import reportflow.engine.model.RunTrigger;
import reportflow.engine.repository.NotificationRepository;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LogNotifierTest {

    private static final Instant T0 = Instant.parse("2024-01-08T09:00:00Z");

    private final List<NotificationRecord> stored = new ArrayList<>();
    private final NotificationRepository repository = new NotificationRepository() {
        @Override
        public void append(NotificationRecord record) {
            stored.add(record);
        }

        @Override
        public List<NotificationRecord> findByRunId(String runId) {
            return stored.stream().filter(r -> r.runId().equals(runId)).toList();
        }
    };

    private final LogNotifier notifier = new LogNotifier(repository,
            Clock.fixed(T0.plusSeconds(10), ZoneOffset.UTC));

    private final Job job = Job.builder()
            .id("job-1")
            .name("Daily Sales")
            .query("SELECT 1")
            .schedule("0 9 * * *")
            .build();

    @Test
    void successMessage() {
        Run run = Run.queued("run-1", "job-1", RunTrigger.SCHEDULED, T0).toRunning()
                .succeed(42, "/out/daily.csv", T0.plusSeconds(3));

        NotificationRecord record = notifier.notify(job, run);

        assertEquals("Report 'Daily Sales' completed successfully. Rows exported: 42. Output: /out/daily.csv",
                record.message());
        assertEquals(NotificationChannel.LOG, record.channel());
        assertEquals(NotificationStatus.SENT, record.status());
        assertEquals(RunState.SUCCESS, record.runState());
        assertEquals(T0.plusSeconds(10), record.sentAt());
        assertEquals(List.of(record), stored);
    }

    @Test
    void failureMessage() {
        Run run = Run.queued("run-2", "job-1", RunTrigger.MANUAL, T0).toRunning()
                .fail("syntax error near SELECT", T0.plusSeconds(1));

        NotificationRecord record = notifier.notify(job, run);

        assertEquals("Report 'Daily Sales' failed. Error: syntax error near SELECT", record.message());
        assertEquals(RunState.FAILED, record.runState());
        assertEquals(1, repository.findByRunId("run-2").size());
    }
}
