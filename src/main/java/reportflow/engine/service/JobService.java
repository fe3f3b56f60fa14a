package reportflow.engine.service;

import reportflow.engine.exception.NotFoundException;
import reportflow.engine.model.Job;
import reportflow.engine.model.OutputFormat;
import reportflow.engine.repository.JobRepository;
import reportflow.engine.scheduler.ReconcileReport;
import reportflow.engine.scheduler.Scheduler;
import reportflow.engine.validation.JobValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Business logic for report job definitions.
 * Every accepted change is followed by a calendar reconcile.
 */
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final JobRepository jobRepository;
    private final Scheduler scheduler;
    private final Clock clock;

    public JobService(JobRepository jobRepository, Scheduler scheduler, Clock clock) {
        this.jobRepository = jobRepository;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * Validate and store a new job, then put it on the calendar if active.
     *
     * @param outputFormat format tag, null for CSV
     * @throws reportflow.engine.exception.ValidationException if any field is rejected
     */
    public Job createJob(String name, String description, String query, String schedule,
            String outputFormat, boolean active) {
        JobValidator.validateName(name);
        JobValidator.validateSchedule(schedule, clock);
        JobValidator.validateQuery(query);
        OutputFormat format = JobValidator.parseOutputFormat(outputFormat);
        Instant now = clock.instant();

        Job job = Job.builder()
                .id(jobRepository.generateId())
                .name(name)
                .description(description)
                .query(query)
                .schedule(schedule)
                .outputFormat(format)
                .active(active)
                .createdAt(now)
                .updatedAt(now)
                .build();

        jobRepository.save(job);
        log.info("Created job {} '{}' ({}, {}, active={})", job.id(), job.name(), job.schedule(), format, active);

        reconcile();
        return job;
    }

    /**
     * Apply a partial update and reconcile the calendar.
     *
     * @throws NotFoundException if the job does not exist
     * @throws reportflow.engine.exception.ValidationException if the merged job is invalid
     */
    public Job updateJob(String jobId, JobChanges changes) {
        Job current = jobRepository.findById(jobId).orElseThrow(() -> NotFoundException.job(jobId));

        Job.Builder builder = current.toBuilder();
        if (changes.name() != null) {
            builder.name(changes.name());
        }
        if (changes.description() != null) {
            builder.description(changes.description());
        }
        if (changes.query() != null) {
            builder.query(changes.query());
        }
        if (changes.schedule() != null) {
            builder.schedule(changes.schedule());
        }
        if (changes.outputFormat() != null) {
            builder.outputFormat(JobValidator.parseOutputFormat(changes.outputFormat()));
        }
        if (changes.active() != null) {
            builder.active(changes.active());
        }
        Job updated = builder.updatedAt(clock.instant()).build();
        JobValidator.validate(updated, clock);

        if (!jobRepository.update(updated)) {
            throw NotFoundException.job(jobId);
        }
        log.info("Updated job {} '{}' (active={})", updated.id(), updated.name(), updated.active());

        reconcile();
        return updated;
    }

    public Job getJob(String jobId) {
        return jobRepository.findById(jobId).orElseThrow(() -> NotFoundException.job(jobId));
    }

    public Optional<Job> findById(String jobId) {
        return jobRepository.findById(jobId);
    }

    public List<Job> listJobs(int offset, int limit) {
        return jobRepository.findAll(offset, limit);
    }

    /**
     * Rebuild the calendar from the stored active jobs.
     */
    public ReconcileReport reconcile() {
        return scheduler.reconcile(jobRepository::findActive);
    }
}
