package reportflow.engine.scheduler;

import java.util.List;

/**
 * Outcome of a calendar rebuild.
 *
 * @param scheduled number of jobs now in the calendar
 * @param skipped   inactive jobs that were ignored
 * @param warnings  jobs dropped because their schedule is unusable, one line each
 */
public record ReconcileReport(int scheduled, int skipped, List<String> warnings) {

    public ReconcileReport {
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
