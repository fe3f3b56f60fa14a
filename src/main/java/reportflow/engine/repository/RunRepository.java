package reportflow.engine.repository;

import reportflow.engine.model.Run;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for run history.
 */
public interface RunRepository {

    /**
     * Insert a new run record.
     */
    void save(Run run);

    /**
     * Persist a state transition of an existing run.
     * Idempotent when the stored run is already terminal with the same outcome.
     *
     * @throws IllegalStateException if the stored run is terminal with a different outcome
     * @throws reportflow.engine.exception.StoreException if the run does not exist or the write fails
     */
    void update(Run run);

    Optional<Run> findById(String runId);

    /**
     * Run history of a job, newest first.
     */
    List<Run> findByJobId(String jobId, int offset, int limit);

    /**
     * Generate a new unique Run ID.
     */
    String generateId();
}
