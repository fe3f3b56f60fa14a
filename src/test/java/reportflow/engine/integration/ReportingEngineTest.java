package reportflow.engine.integration;

import reportflow.engine.ReportingEngine;
import reportflow.engine.config.Dependencies;
import reportflow.engine.config.EngineConfig;
import reportflow.engine.model.Job;
import reportflow.engine.model.Run;
import reportflow.engine.model.RunState;
import reportflow.engine.scheduler.ReconcileReport;
import reportflow.engine.store.Database;
import reportflow.engine.store.JdbcRunRepository;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Startup and shutdown of the engine against a store that already holds jobs.
 */
class ReportingEngineTest {

    @TempDir
    Path outputDir;

    private EngineConfig config;
    private Dependencies deps;

    @BeforeEach
    void setUp() {
        config = EngineConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-engine-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withOutputDir(outputDir);
        deps = Dependencies.create(config);
    }

    @AfterEach
    void tearDown() {
        deps.close();
    }

    private void store(String id, String schedule, boolean active) {
        deps.jobRepository().save(Job.builder()
                .id(id)
                .name(id)
                .query("SELECT 1")
                .schedule(schedule)
                .active(active)
                .createdAt(Instant.now())
                .build());
    }

    @Test
    @DisplayName("Startup schedules stored active jobs and reports unusable ones")
    void startupReconcilesStoredJobs() {
        store("job-daily", "0 9 * * *", true);
        store("job-hourly", "0 * * * *", true);
        store("job-off", "0 9 * * *", false);
        // written around validation, e.g. by an older version
        store("job-broken", "0 25 * * *", true);

        ReportingEngine engine = new ReportingEngine(deps);
        ReconcileReport report = engine.startup();

        assertEquals(2, report.scheduled());
        assertEquals(1, report.warnings().size());
        assertTrue(report.warnings().get(0).contains("job-broken"));
        assertTrue(deps.scheduler().isRunning());
        assertTrue(deps.scheduler().nextFireTime("job-daily").isPresent());
        assertTrue(deps.scheduler().nextFireTime("job-off").isEmpty());

        engine.shutdown();
        assertFalse(deps.scheduler().isRunning());
        engine.shutdown();
    }

    @Test
    @DisplayName("Closing while a scheduled run is in flight leaves that run terminal in the store")
    void closeDrainsScheduledRuns() throws Exception {
        deps.close();
        // fire the every-minute job a few seconds after startup
        Instant real = Instant.now();
        Instant boundary = real.truncatedTo(ChronoUnit.MINUTES).plus(1, ChronoUnit.MINUTES);
        Clock clock = Clock.offset(Clock.systemUTC(), Duration.between(real, boundary).minusMillis(3000));
        deps = Dependencies.create(config, clock);

        Job job = deps.jobService().createJob("Slow sum", null,
                "SELECT SUM(X) AS total FROM SYSTEM_RANGE(1, 20000000)", "* * * * *", "csv", true);
        ReportingEngine engine = new ReportingEngine(deps);
        engine.startup();

        List<Run> started = List.of();
        long deadline = System.currentTimeMillis() + 15_000;
        while (started.isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
            started = deps.runRepository().findByJobId(job.id(), 0, 10);
        }
        assertFalse(started.isEmpty(), "scheduled run never started");

        deps.close();

        try (Database reopened = new Database(config)) {
            List<Run> stored = new JdbcRunRepository(reopened).findByJobId(job.id(), 0, 10);
            assertFalse(stored.isEmpty());
            for (Run run : stored) {
                assertTrue(run.isTerminal(), "run left in " + run.state());
                assertNotNull(run.finishedAt());
            }
            assertEquals(RunState.SUCCESS, stored.get(stored.size() - 1).state());
        }
    }
}
