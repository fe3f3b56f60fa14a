package reportflow.engine.runner;

import reportflow.engine.exception.BusyException;
import reportflow.engine.exception.NotFoundException;
import reportflow.engine.exception.RunPersistenceException;
import reportflow.engine.export.ArtifactNames;
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
import reportflow.engine.repository.JobRepository;
import reportflow.engine.repository.RunRepository;
import reportflow.engine.validation.QueryValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Executes one run of a job end to end: query, artifact, terminal state, notification.
 *
 * <p>{@link #run} blocks until the run is terminal. At most one call per job is in
 * flight at a time; a concurrent call for the same job gets {@link BusyException}
 * immediately and leaves no run record behind.</p>
 *
 * <p>Query and writer failures become FAILED runs. Only failures to persist the run
 * itself are thrown, as {@link RunPersistenceException}.</p>
 */
public class ExecutionRunner {

    private static final Logger log = LoggerFactory.getLogger(ExecutionRunner.class);

    private final JobRepository jobRepository;
    private final RunRepository runRepository;
    private final QuerySink querySink;
    private final Map<OutputFormat, ResultWriter> writers;
    private final Notifier notifier;
    private final ExclusivityTokens tokens;
    private final Clock clock;
    private final ZoneId zone;

    public ExecutionRunner(JobRepository jobRepository,
            RunRepository runRepository,
            QuerySink querySink,
            List<ResultWriter> writers,
            Notifier notifier,
            ExclusivityTokens tokens,
            Clock clock,
            ZoneId zone) {
        this.jobRepository = jobRepository;
        this.runRepository = runRepository;
        this.querySink = querySink;
        this.writers = new EnumMap<>(OutputFormat.class);
        for (ResultWriter writer : writers) {
            this.writers.put(writer.format(), writer);
        }
        this.notifier = notifier;
        this.tokens = tokens;
        this.clock = clock;
        this.zone = zone;
    }

    /**
     * Execute the job once and return the terminal run.
     *
     * @throws NotFoundException        if the job does not exist
     * @throws BusyException            if a run of this job is already in flight
     * @throws RunPersistenceException if a run transition could not be stored
     */
    public Run run(String jobId, RunTrigger trigger) {
        Job job = jobRepository.findById(jobId).orElseThrow(() -> NotFoundException.job(jobId));

        ExclusivityToken token = tokens.tokenFor(jobId);
        if (!token.tryAcquire()) {
            log.info("Job {} is already running, {} trigger rejected", jobId, trigger);
            throw new BusyException(jobId);
        }

        try {
            return execute(job, trigger);
        } finally {
            token.release();
        }
    }

    private Run execute(Job job, RunTrigger trigger) {
        Run run = Run.queued(runRepository.generateId(), job.id(), trigger, clock.instant());
        persist(run, true);

        run = run.toRunning();
        persist(run, false);
        log.info("Run {} of job '{}' started ({})", run.id(), job.name(), trigger);

        Run terminal;
        try {
            QueryValidator.validate(job.query());
            QueryResult result = querySink.execute(job.query());

            ResultWriter writer = writerFor(job.outputFormat());
            String baseName = ArtifactNames.baseName(job.name(), run.startedAt(), run.id(), zone);
            WrittenArtifact artifact = writer.write(result, baseName);

            terminal = run.succeed(artifact.rowCount(), artifact.path().toString(), finishedAt(run));
        } catch (Exception e) {
            log.debug("Run {} failed", run.id(), e);
            terminal = run.fail(describe(e), finishedAt(run));
        }

        persist(terminal, false);
        if (terminal.state() == RunState.FAILED) {
            log.warn("Run {} of job '{}' FAILED: {}", terminal.id(), job.name(), terminal.error());
        } else {
            log.info("Run {} of job '{}' SUCCESS: {} rows -> {}",
                    terminal.id(), job.name(), terminal.rowCount(), terminal.artifactPath());
        }

        try {
            notifier.notify(job, terminal);
        } catch (Exception e) {
            log.warn("Notification for run {} failed: {}", terminal.id(), e.getMessage());
        }
        return terminal;
    }

    private ResultWriter writerFor(OutputFormat format) {
        ResultWriter writer = writers.get(format);
        if (writer == null) {
            throw new IllegalStateException("No result writer for format " + format);
        }
        return writer;
    }

    private void persist(Run run, boolean insert) {
        try {
            if (insert) {
                runRepository.save(run);
            } else {
                runRepository.update(run);
            }
        } catch (RuntimeException e) {
            log.error("Failed to persist run {} in state {}", run.id(), run.state(), e);
            throw new RunPersistenceException(run.id(),
                    "Failed to persist run " + run.id() + " as " + run.state() + ": " + e.getMessage(), e);
        }
    }

    // Clock may step backwards; finishedAt must never precede startedAt
    private Instant finishedAt(Run run) {
        Instant now = clock.instant();
        return now.isBefore(run.startedAt()) ? run.startedAt() : now;
    }

    static String describe(Throwable e) {
        String message = e.getMessage();
        return message != null ? message : e.getClass().getName();
    }

    public ExclusivityTokens tokens() {
        return tokens;
    }
}
