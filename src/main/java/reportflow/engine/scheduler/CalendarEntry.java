package reportflow.engine.scheduler;

import reportflow.engine.cron.CronExpression;
import reportflow.engine.model.Job;
import reportflow.engine.runner.ExclusivityToken;

import java.time.Instant;

/**
 * One scheduled job in the calendar: its parsed schedule, the next instant it
 * fires and the exclusivity token shared with the execution runner.
 */
public record CalendarEntry(
        Job job,
        CronExpression schedule,
        Instant nextFire,
        ExclusivityToken token) {

    public String jobId() {
        return job.id();
    }

    public boolean isDue(Instant now) {
        return !nextFire.isAfter(now);
    }

    public CalendarEntry withNextFire(Instant next) {
        return new CalendarEntry(job, schedule, next, token);
    }
}
