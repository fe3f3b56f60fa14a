package reportflow.engine.scheduler;

import reportflow.engine.cron.CronExpression;
import reportflow.engine.exception.BusyException;
import reportflow.engine.exception.NotFoundException;
import reportflow.engine.exception.RunPersistenceException;
import reportflow.engine.exception.ValidationException;
import reportflow.engine.model.Job;
import reportflow.engine.model.Run;
import reportflow.engine.model.RunTrigger;
import reportflow.engine.runner.ExecutionRunner;
import reportflow.engine.runner.ExclusivityTokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Cron-driven dispatcher of scheduled runs.
 *
 * A single timing thread sleeps until the earliest next-fire time in the
 * calendar, hands every due job to the worker pool and recomputes its next
 * fire time. Execution is fire-and-continue: a slow job never delays the
 * dispatch of another.
 *
 * The calendar is an immutable map replaced wholesale by {@link #reconcile},
 * under the same lock the timing loop waits on, so there is no window in
 * which an active job is missing from it.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    /** Longest single sleep; bounds the effect of wall-clock jumps */
    private static final Duration MAX_WAIT = Duration.ofMinutes(1);

    /** How long {@link #stop()} waits for dispatched runs to reach a terminal state */
    private static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(30);

    private enum Lifecycle {
        NEW, RUNNING, STOPPED
    }

    private final ExecutionRunner runner;
    private final ExclusivityTokens tokens;
    private final Clock clock;
    private final ZoneId zone;
    private final ExecutorService workers;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    // serializes read-active-jobs + swap across concurrent reconcile callers
    private final ReentrantLock reconcileLock = new ReentrantLock();

    private volatile Map<String, CalendarEntry> calendar = Map.of();
    private volatile Lifecycle lifecycle = Lifecycle.NEW;
    private Thread loopThread;

    public Scheduler(ExecutionRunner runner, ExclusivityTokens tokens, Clock clock, ZoneId zone, int workerThreads) {
        this.runner = runner;
        this.tokens = tokens;
        this.clock = clock;
        this.zone = zone;
        AtomicInteger counter = new AtomicInteger(1);
        this.workers = Executors.newFixedThreadPool(workerThreads, r -> {
            Thread t = new Thread(r, "reportflow-worker-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start the timing loop.
     *
     * @throws IllegalStateException if the scheduler was stopped
     */
    public void start() {
        lock.lock();
        try {
            if (lifecycle == Lifecycle.RUNNING) {
                log.warn("Scheduler already running");
                return;
            }
            if (lifecycle == Lifecycle.STOPPED) {
                throw new IllegalStateException("Scheduler was stopped and cannot be restarted");
            }
            lifecycle = Lifecycle.RUNNING;
            loopThread = new Thread(this::loop, "reportflow-scheduler");
            loopThread.setDaemon(true);
            loopThread.start();
        } finally {
            lock.unlock();
        }
        log.info("Scheduler started with {} scheduled jobs", calendar.size());
    }

    /**
     * Stop dispatching, wait for the timing thread to exit, then wait up to
     * {@code DRAIN_TIMEOUT} for runs already handed to the worker pool to finish.
     * On return those runs are terminal in the store, so callers may close it.
     * Idempotent.
     */
    public void stop() {
        Thread thread;
        lock.lock();
        try {
            if (lifecycle == Lifecycle.STOPPED) {
                return;
            }
            lifecycle = Lifecycle.STOPPED;
            thread = loopThread;
            changed.signalAll();
        } finally {
            lock.unlock();
        }

        if (thread != null) {
            try {
                thread.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Scheduled runs still in flight after {}s, stopping without them", DRAIN_TIMEOUT.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for scheduled runs to finish");
        }
        log.info("Scheduler stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return lifecycle == Lifecycle.RUNNING;
    }

    /**
     * Replace the whole calendar with the given active jobs. Jobs whose
     * schedule cannot be parsed or never fires are left out and reported.
     */
    public ReconcileReport reconcile(Collection<Job> activeJobs) {
        return reconcile(() -> activeJobs);
    }

    /**
     * Read the active jobs and replace the calendar with them as one step.
     * Concurrent callers are serialized, so the last swap always reflects the
     * latest read.
     */
    public ReconcileReport reconcile(Supplier<? extends Collection<Job>> activeJobs) {
        reconcileLock.lock();
        try {
            return rebuild(activeJobs.get());
        } finally {
            reconcileLock.unlock();
        }
    }

    private ReconcileReport rebuild(Collection<Job> activeJobs) {
        Map<Job, CronExpression> parsed = new LinkedHashMap<>();
        List<String> warnings = new ArrayList<>();
        int skipped = 0;

        for (Job job : activeJobs) {
            if (!job.active()) {
                skipped++;
                continue;
            }
            try {
                parsed.put(job, CronExpression.parse(job.schedule()));
            } catch (ValidationException e) {
                warnings.add(dropped(job, e));
            }
        }

        Map<String, CalendarEntry> next = new LinkedHashMap<>();
        lock.lock();
        try {
            // fire times are computed under the lock so a dispatch cannot slip in between
            Instant now = clock.instant();
            for (Map.Entry<Job, CronExpression> e : parsed.entrySet()) {
                Job job = e.getKey();
                CronExpression schedule = e.getValue();
                Instant fire;
                try {
                    fire = schedule.nextFireAfter(now, zone);
                } catch (IllegalStateException ex) {
                    warnings.add(dropped(job, ex));
                    continue;
                }
                CalendarEntry current = calendar.get(job.id());
                if (current != null && current.schedule().equals(schedule) && current.nextFire().isAfter(fire)) {
                    // this slot was already dispatched
                    fire = current.nextFire();
                }
                next.put(job.id(), new CalendarEntry(job, schedule, fire, tokens.tokenFor(job.id())));
            }
            calendar = Map.copyOf(next);
            changed.signalAll();
        } finally {
            lock.unlock();
        }

        log.info("Calendar reconciled: {} scheduled, {} inactive, {} dropped", next.size(), skipped, warnings.size());
        return new ReconcileReport(next.size(), skipped, warnings);
    }

    private static String dropped(Job job, RuntimeException e) {
        String warning = "job " + job.id() + " ('" + job.name() + "') dropped from calendar: " + e.getMessage();
        log.warn(warning);
        return warning;
    }

    /** Snapshot of the current calendar, keyed by job ID */
    public Map<String, CalendarEntry> calendar() {
        return calendar;
    }

    public Optional<Instant> nextFireTime(String jobId) {
        CalendarEntry entry = calendar.get(jobId);
        return entry == null ? Optional.empty() : Optional.of(entry.nextFire());
    }

    private void loop() {
        lock.lock();
        try {
            while (lifecycle == Lifecycle.RUNNING) {
                Optional<Instant> earliest = calendar.values().stream()
                        .map(CalendarEntry::nextFire)
                        .min(Instant::compareTo);

                if (earliest.isEmpty()) {
                    changed.await(MAX_WAIT.toNanos(), TimeUnit.NANOSECONDS);
                    continue;
                }

                Duration wait = Duration.between(clock.instant(), earliest.get());
                if (!wait.isNegative() && !wait.isZero()) {
                    long nanos = Math.min(wait.toNanos(), MAX_WAIT.toNanos());
                    changed.awaitNanos(nanos);
                    continue;
                }

                dispatchDue(clock.instant());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Scheduler loop interrupted");
        } catch (RuntimeException e) {
            log.error("Scheduler loop crashed", e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Dispatch every entry due at {@code now} and advance it to its next fire
     * time. Returns the IDs of the jobs handed to the worker pool.
     */
    List<String> dispatchDue(Instant now) {
        lock.lock();
        try {
            if (lifecycle == Lifecycle.STOPPED) {
                return List.of();
            }
            List<String> dispatched = new ArrayList<>();
            Map<String, CalendarEntry> next = new LinkedHashMap<>(calendar);

            for (CalendarEntry entry : calendar.values()) {
                if (!entry.isDue(now)) {
                    continue;
                }
                if (entry.token().isHeld()) {
                    log.info("Job {} is already running, skipping scheduled fire at {}", entry.jobId(), entry.nextFire());
                } else {
                    log.debug("Dispatching job {} due at {}", entry.jobId(), entry.nextFire());
                    workers.execute(() -> execute(entry.jobId()));
                    dispatched.add(entry.jobId());
                }

                try {
                    next.put(entry.jobId(), entry.withNextFire(entry.schedule().nextFireAfter(now, zone)));
                } catch (IllegalStateException e) {
                    log.warn("Job {} has no further fire time, removing from calendar", entry.jobId());
                    next.remove(entry.jobId());
                }
            }

            calendar = Map.copyOf(next);
            return dispatched;
        } finally {
            lock.unlock();
        }
    }

    private void execute(String jobId) {
        try {
            Run run = runner.run(jobId, RunTrigger.SCHEDULED);
            log.debug("Scheduled run {} of job {} finished as {}", run.id(), jobId, run.state());
        } catch (BusyException e) {
            log.info("Job {} is already running, scheduled run skipped", jobId);
        } catch (NotFoundException e) {
            log.warn("Scheduled job {} no longer exists", jobId);
        } catch (RunPersistenceException e) {
            log.error("Scheduled run {} of job {} could not be persisted", e.runId(), jobId, e);
        } catch (Exception e) {
            log.error("Scheduled run of job {} failed unexpectedly", jobId, e);
        }
    }
}
