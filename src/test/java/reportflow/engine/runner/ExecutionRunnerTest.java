package reportflow.engine.runner;

import reportflow.engine.config.EngineConfig;
import reportflow.engine.exception.BusyException;
import reportflow.engine.exception.DataAccessException;
import reportflow.engine.exception.NotFoundException;
import reportflow.engine.exception.RunPersistenceException;
import reportflow.engine.export.CsvResultWriter;
import reportflow.engine.export.JsonResultWriter;
import reportflow.engine.export.ResultWriter;
import reportflow.engine.model.Job;
import reportflow.engine.model.OutputFormat;
import reportflow.engine.model.QueryResult;
import reportflow.engine.model.Run;
import reportflow.engine.model.RunState;
import reportflow.engine.model.RunTrigger;
import reportflow.engine.model.WrittenArtifact;
import reportflow.engine.notify.Notifier;
import reportflow.engine.query.QuerySink;
import reportflow.engine.repository.RunRepository;
import reportflow.engine.store.Database;
import reportflow.engine.store.JdbcJobRepository;
import reportflow.engine.store.JdbcRunRepository;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionRunnerTest {

    private static final QueryResult THREE_ROWS = new QueryResult(
            List.of("id", "name"),
            List.of(List.of(1, "a"), List.of(2, "b"), List.of(3, "c")));

    @TempDir
    Path outputDir;

    private Database db;
    private JdbcJobRepository jobs;
    private JdbcRunRepository runs;
    private ExclusivityTokens tokens;
    private final List<Run> notified = Collections.synchronizedList(new ArrayList<>());

    @BeforeEach
    void setUp() {
        EngineConfig config = EngineConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-runner-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        jobs = new JdbcJobRepository(db);
        runs = new JdbcRunRepository(db);
        tokens = new ExclusivityTokens();
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private Job saveJob(String query, OutputFormat format) {
        Job job = Job.builder()
                .id(jobs.generateId())
                .name("Daily Sales")
                .query(query)
                .schedule("0 9 * * *")
                .outputFormat(format)
                .createdAt(Instant.now())
                .build();
        jobs.save(job);
        return job;
    }

    private ExecutionRunner runner(QuerySink sink, Notifier notifier) {
        return runner(sink, notifier, runs);
    }

    private ExecutionRunner runner(QuerySink sink, Notifier notifier, RunRepository runRepository) {
        List<ResultWriter> writers = List.of(new CsvResultWriter(outputDir), new JsonResultWriter(outputDir));
        return new ExecutionRunner(jobs, runRepository, sink, writers, notifier, tokens,
                Clock.systemUTC(), ZoneOffset.UTC);
    }

    private Notifier recording() {
        return (job, run) -> {
            notified.add(run);
            return null;
        };
    }

    @Test
    @DisplayName("Three-row query produces a SUCCESS run with its artifact")
    void successfulRun() throws Exception {
        Job job = saveJob("SELECT id, name FROM customers", OutputFormat.CSV);

        Run run = runner(q -> THREE_ROWS, recording()).run(job.id(), RunTrigger.MANUAL);

        assertEquals(RunState.SUCCESS, run.state());
        assertEquals(3, run.rowCount());
        assertNotNull(run.artifactPath());
        assertFalse(run.artifactPath().isEmpty());
        assertFalse(run.finishedAt().isBefore(run.startedAt()));
        assertEquals(RunTrigger.MANUAL, run.trigger());

        Path artifact = Path.of(run.artifactPath());
        assertTrue(Files.exists(artifact));
        assertTrue(artifact.getFileName().toString().startsWith("Daily_Sales_"));
        assertTrue(artifact.getFileName().toString().endsWith("_" + run.id() + ".csv"));
        assertEquals(4, Files.readAllLines(artifact).size());

        Run stored = runs.findById(run.id()).orElseThrow();
        assertEquals(RunState.SUCCESS, stored.state());
        assertEquals(3, stored.rowCount());

        assertEquals(1, notified.size());
        assertEquals(RunState.SUCCESS, notified.get(0).state());
        assertFalse(tokens.tokenFor(job.id()).isHeld());
    }

    @Test
    void jsonFormatUsesJsonWriter() {
        Job job = saveJob("SELECT 1", OutputFormat.JSON);
        Run run = runner(q -> THREE_ROWS, recording()).run(job.id(), RunTrigger.SCHEDULED);
        assertTrue(run.artifactPath().endsWith(".json"));
    }

    @Test
    @DisplayName("Query failure produces a FAILED run carrying the driver message")
    void failedQuery() {
        Job job = saveJob("SELECT * FROM broken", OutputFormat.CSV);
        QuerySink failing = q -> {
            throw new DataAccessException("syntax error near SELECT");
        };

        Run run = runner(failing, recording()).run(job.id(), RunTrigger.MANUAL);

        assertEquals(RunState.FAILED, run.state());
        assertEquals("syntax error near SELECT", run.error());
        assertNull(run.rowCount());
        assertNull(run.artifactPath());
        assertNotNull(run.finishedAt());

        assertEquals(RunState.FAILED, runs.findById(run.id()).orElseThrow().state());
        assertEquals(1, notified.size());
        assertEquals(RunState.FAILED, notified.get(0).state());
    }

    @Test
    void writerFailureFailsRun() {
        Job job = saveJob("SELECT 1", OutputFormat.CSV);
        ResultWriter broken = new ResultWriter() {
            @Override
            public OutputFormat format() {
                return OutputFormat.CSV;
            }

            @Override
            public WrittenArtifact write(QueryResult result, String baseName) throws IOException {
                throw new IOException("disk full");
            }
        };
        ExecutionRunner runner = new ExecutionRunner(jobs, runs, q -> THREE_ROWS, List.of(broken),
                recording(), tokens, Clock.systemUTC(), ZoneOffset.UTC);

        Run run = runner.run(job.id(), RunTrigger.MANUAL);

        assertEquals(RunState.FAILED, run.state());
        assertEquals("disk full", run.error());
    }

    @Test
    void nullMessageFallsBackToClassName() {
        Job job = saveJob("SELECT 1", OutputFormat.CSV);
        Run run = runner(q -> {
            throw new NullPointerException();
        }, recording()).run(job.id(), RunTrigger.MANUAL);

        assertEquals("java.lang.NullPointerException", run.error());
    }

    @Test
    @DisplayName("Write queries stored in the job never reach the query sink")
    void guardRecheckedBeforeExecution() {
        // bypass the service-level validation by writing straight to the store
        Job job = saveJob("DELETE FROM reports", OutputFormat.CSV);
        AtomicInteger sinkCalls = new AtomicInteger();

        Run run = runner(q -> {
            sinkCalls.incrementAndGet();
            return THREE_ROWS;
        }, recording()).run(job.id(), RunTrigger.SCHEDULED);

        assertEquals(RunState.FAILED, run.state());
        assertTrue(run.error().contains("DELETE"));
        assertEquals(0, sinkCalls.get());
    }

    @Test
    void notifierFailureDoesNotChangeOutcome() {
        Job job = saveJob("SELECT 1", OutputFormat.CSV);
        Notifier exploding = (j, r) -> {
            throw new IllegalStateException("smtp down");
        };

        Run run = runner(q -> THREE_ROWS, exploding).run(job.id(), RunTrigger.MANUAL);

        assertEquals(RunState.SUCCESS, run.state());
        assertEquals(RunState.SUCCESS, runs.findById(run.id()).orElseThrow().state());
        assertFalse(tokens.tokenFor(job.id()).isHeld());
    }

    @Test
    void unknownJob() {
        assertThrows(NotFoundException.class,
                () -> runner(q -> THREE_ROWS, recording()).run("job-missing", RunTrigger.MANUAL));
    }

    @Test
    void persistenceFailureIsPropagated() {
        Job job = saveJob("SELECT 1", OutputFormat.CSV);
        RunRepository failingTerminal = new RunRepository() {
            @Override
            public void save(Run run) {
                runs.save(run);
            }

            @Override
            public void update(Run run) {
                if (run.isTerminal()) {
                    throw new IllegalStateException("store offline");
                }
                runs.update(run);
            }

            @Override
            public Optional<Run> findById(String runId) {
                return runs.findById(runId);
            }

            @Override
            public List<Run> findByJobId(String jobId, int offset, int limit) {
                return runs.findByJobId(jobId, offset, limit);
            }

            @Override
            public String generateId() {
                return runs.generateId();
            }
        };

        ExecutionRunner runner = runner(q -> THREE_ROWS, recording(), failingTerminal);
        RunPersistenceException e = assertThrows(RunPersistenceException.class,
                () -> runner.run(job.id(), RunTrigger.MANUAL));

        assertNotNull(e.runId());
        assertTrue(notified.isEmpty());
        assertFalse(tokens.tokenFor(job.id()).isHeld());
    }

    @Test
    @DisplayName("Concurrent triggers for one job: exactly one runs, the rest are Busy")
    void concurrentTriggersAreExclusive() throws Exception {
        Job job = saveJob("SELECT 1", OutputFormat.CSV);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger executions = new AtomicInteger();

        QuerySink blocking = q -> {
            executions.incrementAndGet();
            entered.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return THREE_ROWS;
        };
        ExecutionRunner runner = runner(blocking, recording());

        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            Future<Run> first = pool.submit(() -> runner.run(job.id(), RunTrigger.MANUAL));
            assertTrue(entered.await(10, TimeUnit.SECONDS));

            List<Future<Run>> others = new ArrayList<>();
            for (int i = 1; i < callers; i++) {
                others.add(pool.submit(() -> runner.run(job.id(), RunTrigger.MANUAL)));
            }
            for (Future<Run> other : others) {
                Exception e = assertThrows(Exception.class, () -> other.get(10, TimeUnit.SECONDS));
                assertInstanceOf(BusyException.class, e.getCause());
            }

            release.countDown();
            assertEquals(RunState.SUCCESS, first.get(10, TimeUnit.SECONDS).state());
        } finally {
            release.countDown();
            pool.shutdownNow();
        }

        assertEquals(1, executions.get());
        assertEquals(1, runs.findByJobId(job.id(), 0, 50).size());

        // token is free again afterwards
        assertEquals(RunState.SUCCESS, runner(q -> THREE_ROWS, recording()).run(job.id(), RunTrigger.MANUAL).state());
    }

    @Test
    void tokensAreIndependentPerJob() {
        ExclusivityToken a = tokens.tokenFor("job-a");
        assertTrue(a.tryAcquire());
        assertFalse(a.tryAcquire());
        assertSame(a, tokens.tokenFor("job-a"));
        assertTrue(tokens.tokenFor("job-b").tryAcquire());
        assertEquals(2, tokens.runningCount());
        a.release();
        assertFalse(tokens.isRunning("job-a"));
        assertThrows(IllegalStateException.class, a::release);
    }
}
