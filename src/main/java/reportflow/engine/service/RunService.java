package reportflow.engine.service;

import reportflow.engine.exception.NotFoundException;
import reportflow.engine.exception.NotReadyException;
import reportflow.engine.model.Run;
import reportflow.engine.model.RunState;
import reportflow.engine.model.RunTrigger;
import reportflow.engine.repository.JobRepository;
import reportflow.engine.repository.RunRepository;
import reportflow.engine.runner.ExecutionRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Manual triggers and run history.
 */
public class RunService {

    private static final Logger log = LoggerFactory.getLogger(RunService.class);

    public static final int DEFAULT_LIMIT = 50;

    private final ExecutionRunner runner;
    private final JobRepository jobRepository;
    private final RunRepository runRepository;

    public RunService(ExecutionRunner runner, JobRepository jobRepository, RunRepository runRepository) {
        this.runner = runner;
        this.jobRepository = jobRepository;
        this.runRepository = runRepository;
    }

    /**
     * Run the job now on the calling thread and return the terminal run.
     *
     * @throws NotFoundException                              if the job does not exist
     * @throws reportflow.engine.exception.BusyException      if the job is already running
     */
    public Run manualRun(String jobId) {
        log.info("Manual run requested for job {}", jobId);
        return runner.run(jobId, RunTrigger.MANUAL);
    }

    /**
     * Run history of a job, newest first.
     *
     * @throws NotFoundException if the job does not exist
     */
    public List<Run> listRuns(String jobId, int offset, int limit) {
        if (jobRepository.findById(jobId).isEmpty()) {
            throw NotFoundException.job(jobId);
        }
        return runRepository.findByJobId(jobId, Math.max(0, offset), limit > 0 ? limit : DEFAULT_LIMIT);
    }

    public Run getRun(String runId) {
        return runRepository.findById(runId).orElseThrow(() -> NotFoundException.run(runId));
    }

    /**
     * Location of a successful run's artifact.
     *
     * @throws NotFoundException if the run or its file does not exist
     * @throws NotReadyException if the run did not succeed
     */
    public Path fetchArtifact(String runId) {
        Run run = getRun(runId);
        if (run.state() != RunState.SUCCESS) {
            throw new NotReadyException("Run " + runId + " did not complete successfully. Status: " + run.state());
        }
        Path path = Path.of(run.artifactPath());
        if (!Files.isRegularFile(path)) {
            throw new NotFoundException("Output file not found for run " + runId);
        }
        return path;
    }
}
