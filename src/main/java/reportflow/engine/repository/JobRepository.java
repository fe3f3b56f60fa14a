package reportflow.engine.repository;

import reportflow.engine.model.Job;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Job persistence.
 */
public interface JobRepository {

    /**
     * Save a new job.
     * 
     * @param job the job to save
     */
    void save(Job job);

    /**
     * Replace an existing job definition.
     * 
     * @param job the updated job
     * @return true if a job with that ID existed
     */
    boolean update(Job job);

    /**
     * Find a job by ID.
     * 
     * @param jobId the job ID
     * @return the job if found
     */
    Optional<Job> findById(String jobId);

    /**
     * Get jobs ordered by creation time, oldest first.
     * 
     * @param offset rows to skip
     * @param limit  maximum results
     * @return list of jobs
     */
    List<Job> findAll(int offset, int limit);

    /**
     * Get all active jobs. This is the input to calendar reconciliation.
     * 
     * @return list of active jobs
     */
    List<Job> findActive();

    /**
     * Generate a new unique Job ID.
     * 
     * @return unique ID like "job-{uuid}"
     */
    String generateId();
}
