package reportflow.engine.config;

import reportflow.engine.api.v1.HealthController;
import reportflow.engine.api.v1.JobController;
import reportflow.engine.api.v1.RunController;
import reportflow.engine.export.CsvResultWriter;
import reportflow.engine.export.JsonResultWriter;
import reportflow.engine.notify.LogNotifier;
import reportflow.engine.notify.Notifier;
import reportflow.engine.query.JdbcQuerySink;
import reportflow.engine.query.QuerySink;
import reportflow.engine.repository.JobRepository;
import reportflow.engine.repository.NotificationRepository;
import reportflow.engine.repository.RunRepository;
import reportflow.engine.runner.ExecutionRunner;
import reportflow.engine.runner.ExclusivityTokens;
import reportflow.engine.scheduler.Scheduler;
import reportflow.engine.server.RouterHandler;
import reportflow.engine.service.JobService;
import reportflow.engine.service.RunService;
import reportflow.engine.store.Database;
import reportflow.engine.store.JdbcJobRepository;
import reportflow.engine.store.JdbcNotificationRepository;
import reportflow.engine.store.JdbcRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(EngineConfig.fromEnv());
 * deps.jobService().createJob(...);
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final EngineConfig config;
    private final Clock clock;
    private final Database database;
    private final Database sourceDatabase;
    private final JobRepository jobRepository;
    private final RunRepository runRepository;
    private final NotificationRepository notificationRepository;
    private final QuerySink querySink;
    private final Notifier notifier;
    private final ExclusivityTokens tokens;
    private final ExecutionRunner executionRunner;
    private final Scheduler scheduler;
    private final JobService jobService;
    private final RunService runService;

    // Controllers
    private final HealthController healthController;
    private final JobController jobController;
    private final RunController runController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(EngineConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.sourceDatabase = config.hasSeparateSource()
                ? Database.forSource(config.sourceUrl(), config.databasePoolSize())
                : database;

        // Repositories
        this.jobRepository = new JdbcJobRepository(database);
        this.runRepository = new JdbcRunRepository(database);
        this.notificationRepository = new JdbcNotificationRepository(database);

        // Execution
        this.querySink = new JdbcQuerySink(sourceDatabase, config.queryTimeoutSeconds(), config.maxRows());
        this.notifier = new LogNotifier(notificationRepository, clock);
        this.tokens = new ExclusivityTokens();
        this.executionRunner = new ExecutionRunner(
                jobRepository,
                runRepository,
                querySink,
                List.of(new CsvResultWriter(config.outputDir()), new JsonResultWriter(config.outputDir())),
                notifier,
                tokens,
                clock,
                config.zone());
        this.scheduler = new Scheduler(executionRunner, tokens, clock, config.zone(), config.workerThreads());

        // Services
        this.jobService = new JobService(jobRepository, scheduler, clock.withZone(config.zone()));
        this.runService = new RunService(executionRunner, jobRepository, runRepository);

        // Controllers (public API)
        this.healthController = new HealthController(database, scheduler, tokens);
        this.jobController = new JobController(jobService, scheduler);
        this.runController = new RunController(runService);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(EngineConfig config) {
        return new Dependencies(config, Clock.system(config.zone()));
    }

    /**
     * Create dependencies with an explicit clock (tests).
     */
    public static Dependencies create(EngineConfig config, Clock clock) {
        return new Dependencies(config, clock);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(EngineConfig.fromEnv());
    }

    // Getters
    public EngineConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public Database database() {
        return database;
    }

    public JobRepository jobRepository() {
        return jobRepository;
    }

    public RunRepository runRepository() {
        return runRepository;
    }

    public NotificationRepository notificationRepository() {
        return notificationRepository;
    }

    public ExclusivityTokens tokens() {
        return tokens;
    }

    public ExecutionRunner executionRunner() {
        return executionRunner;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    public JobService jobService() {
        return jobService;
    }

    public RunService runService() {
        return runService;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(runController)
                    .registerController(jobController);
            log.info("RouterHandler created with {} controllers", 3);
        }
        return routerHandler;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        try {
            scheduler.stop();
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        if (sourceDatabase != database) {
            try {
                sourceDatabase.close();
            } catch (Exception e) {
                log.warn("Error closing source database: {}", e.getMessage());
            }
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
