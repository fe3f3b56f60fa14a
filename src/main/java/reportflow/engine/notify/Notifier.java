package reportflow.engine.notify;

import reportflow.engine.model.Job;
import reportflow.engine.model.NotificationRecord;
import reportflow.engine.model.Run;

/**
 * Receives every terminal run. Implementations may throw; the execution runner
 * logs and ignores notifier failures so they never change a run's outcome.
 */
public interface Notifier {

    NotificationRecord notify(Job job, Run run);
}
