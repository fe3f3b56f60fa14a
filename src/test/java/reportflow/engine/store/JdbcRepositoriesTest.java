package reportflow.engine.store;

import reportflow.engine.config.EngineConfig;
import reportflow.engine.exception.StoreException;
import reportflow.engine.model.Job;
import reportflow.engine.model.NotificationChannel;
import reportflow.engine.model.NotificationRecord;
import reportflow.engine.model.NotificationStatus;
import reportflow.engine.model.OutputFormat;
import reportflow.engine.model.Run;
import reportflow.engine.model.RunState;
import reportflow.engine.model.RunTrigger;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcRepositoriesTest {

    private static final Instant T0 = Instant.parse("2024-01-08T09:00:00Z");

    private static Database db;
    private static JdbcJobRepository jobs;
    private static JdbcRunRepository runs;
    private static JdbcNotificationRepository notifications;

    @BeforeAll
    static void setup() {
        EngineConfig config = EngineConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-repos-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        jobs = new JdbcJobRepository(db);
        runs = new JdbcRunRepository(db);
        notifications = new JdbcNotificationRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void clean() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM notifications");
            st.execute("DELETE FROM runs");
            st.execute("DELETE FROM jobs");
            conn.commit();
        }
    }

    private Job job(String id, boolean active, Instant createdAt) {
        return Job.builder()
                .id(id)
                .name("Report " + id)
                .description("desc")
                .query("SELECT 1")
                .schedule("0 9 * * *")
                .outputFormat(OutputFormat.JSON)
                .active(active)
                .createdAt(createdAt)
                .updatedAt(createdAt)
                .build();
    }

    @Test
    void saveAndFindJob() {
        jobs.save(job("job-a", true, T0));

        Optional<Job> found = jobs.findById("job-a");
        assertTrue(found.isPresent());
        assertEquals("Report job-a", found.get().name());
        assertEquals("desc", found.get().description());
        assertEquals(OutputFormat.JSON, found.get().outputFormat());
        assertEquals("0 9 * * *", found.get().schedule());
        assertTrue(found.get().active());
        assertEquals(T0, found.get().createdAt());

        assertTrue(jobs.findById("job-missing").isEmpty());
    }

    @Test
    void updateJob() {
        jobs.save(job("job-a", true, T0));
        Job changed = jobs.findById("job-a").orElseThrow().toBuilder()
                .schedule("*/5 * * * *")
                .active(false)
                .updatedAt(T0.plusSeconds(60))
                .build();

        assertTrue(jobs.update(changed));
        Job stored = jobs.findById("job-a").orElseThrow();
        assertEquals("*/5 * * * *", stored.schedule());
        assertFalse(stored.active());

        assertFalse(jobs.update(job("job-missing", true, T0)));
    }

    @Test
    void findActiveAndPaging() {
        jobs.save(job("job-1", true, T0));
        jobs.save(job("job-2", false, T0.plusSeconds(1)));
        jobs.save(job("job-3", true, T0.plusSeconds(2)));

        assertEquals(List.of("job-1", "job-3"), jobs.findActive().stream().map(Job::id).toList());
        assertEquals(List.of("job-2", "job-3"), jobs.findAll(1, 10).stream().map(Job::id).toList());
        assertEquals(1, jobs.findAll(0, 1).size());
    }

    @Test
    void generatedIdsAreUnique() {
        assertNotEquals(jobs.generateId(), jobs.generateId());
        assertTrue(runs.generateId().startsWith("run-"));
    }

    @Test
    void runLifecyclePersisted() {
        jobs.save(job("job-a", true, T0));
        Run queued = Run.queued("run-1", "job-a", RunTrigger.SCHEDULED, T0);
        runs.save(queued);

        Run running = queued.toRunning();
        runs.update(running);
        assertEquals(RunState.RUNNING, runs.findById("run-1").orElseThrow().state());

        Run done = running.succeed(3, "/out/a.csv", T0.plusSeconds(4));
        runs.update(done);

        Run stored = runs.findById("run-1").orElseThrow();
        assertEquals(RunState.SUCCESS, stored.state());
        assertEquals(RunTrigger.SCHEDULED, stored.trigger());
        assertEquals(3, stored.rowCount());
        assertEquals("/out/a.csv", stored.artifactPath());
        assertEquals(T0.plusSeconds(4), stored.finishedAt());
        assertNull(stored.error());
    }

    @Test
    void terminalUpdateIsIdempotent() {
        jobs.save(job("job-a", true, T0));
        Run running = Run.queued("run-1", "job-a", RunTrigger.MANUAL, T0).toRunning();
        runs.save(running);

        Run failed = running.fail("boom", T0.plusSeconds(1));
        runs.update(failed);
        assertDoesNotThrow(() -> runs.update(failed));
    }

    @Test
    void terminalRunCannotChange() {
        jobs.save(job("job-a", true, T0));
        Run running = Run.queued("run-1", "job-a", RunTrigger.MANUAL, T0).toRunning();
        runs.save(running);
        runs.update(running.fail("boom", T0.plusSeconds(1)));

        assertThrows(IllegalStateException.class,
                () -> runs.update(running.succeed(1, "/x", T0.plusSeconds(2))));
        assertEquals(RunState.FAILED, runs.findById("run-1").orElseThrow().state());
    }

    @Test
    void updateOfUnknownRunFails() {
        Run running = Run.queued("run-x", "job-a", RunTrigger.MANUAL, T0).toRunning();
        assertThrows(StoreException.class, () -> runs.update(running));
    }

    @Test
    void runHistoryNewestFirst() {
        jobs.save(job("job-a", true, T0));
        jobs.save(job("job-b", true, T0));
        for (int i = 0; i < 5; i++) {
            runs.save(Run.queued("run-" + i, "job-a", RunTrigger.SCHEDULED, T0.plusSeconds(i)));
        }
        runs.save(Run.queued("run-other", "job-b", RunTrigger.SCHEDULED, T0));

        List<String> ids = runs.findByJobId("job-a", 0, 50).stream().map(Run::id).toList();
        assertEquals(List.of("run-4", "run-3", "run-2", "run-1", "run-0"), ids);

        List<String> page = runs.findByJobId("job-a", 1, 2).stream().map(Run::id).toList();
        assertEquals(List.of("run-3", "run-2"), page);
    }

    @Test
    void notificationsAppendOnly() {
        jobs.save(job("job-a", true, T0));
        runs.save(Run.queued("run-1", "job-a", RunTrigger.MANUAL, T0));

        notifications.append(new NotificationRecord("ntf-1", "run-1", NotificationChannel.LOG,
                NotificationStatus.SENT, RunState.FAILED, "Report failed", T0.plusSeconds(1)));

        List<NotificationRecord> found = notifications.findByRunId("run-1");
        assertEquals(1, found.size());
        assertEquals("Report failed", found.get(0).message());
        assertEquals(RunState.FAILED, found.get(0).runState());
        assertEquals(NotificationChannel.LOG, found.get(0).channel());
    }

    @Test
    void healthy() {
        assertTrue(db.isHealthy());
    }
}
