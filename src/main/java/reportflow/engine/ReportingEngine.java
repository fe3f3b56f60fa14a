package reportflow.engine;

import reportflow.engine.config.Dependencies;
import reportflow.engine.scheduler.ReconcileReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process lifecycle of the reporting core: load the active jobs into the
 * calendar and start the timing loop, or stop it.
 */
public class ReportingEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ReportingEngine.class);

    private final Dependencies deps;

    public ReportingEngine(Dependencies deps) {
        this.deps = deps;
    }

    /**
     * Reconcile the calendar against the stored active jobs, then start dispatching.
     */
    public ReconcileReport startup() {
        ReconcileReport report = deps.scheduler().reconcile(deps.jobRepository()::findActive);
        for (String warning : report.warnings()) {
            log.warn("Startup: {}", warning);
        }
        deps.scheduler().start();
        log.info("Reporting engine started: {} jobs scheduled", report.scheduled());
        return report;
    }

    /**
     * Stop dispatching. Returns once in-flight scheduled runs are terminal, or the drain timeout passed.
     */
    public void shutdown() {
        deps.scheduler().stop();
        log.info("Reporting engine stopped");
    }

    @Override
    public void close() {
        shutdown();
    }

    public Dependencies dependencies() {
        return deps;
    }
}
