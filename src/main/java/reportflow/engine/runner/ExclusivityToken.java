package reportflow.engine.runner;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-job guard: at most one holder at a time. Never blocks.
 */
public final class ExclusivityToken {

    private final String jobId;
    private final AtomicBoolean held = new AtomicBoolean(false);

    ExclusivityToken(String jobId) {
        this.jobId = jobId;
    }

    /** @return true if the caller now holds the token */
    public boolean tryAcquire() {
        return held.compareAndSet(false, true);
    }

    public void release() {
        if (!held.compareAndSet(true, false)) {
            throw new IllegalStateException("token for job " + jobId + " released while not held");
        }
    }

    public boolean isHeld() {
        return held.get();
    }

    public String jobId() {
        return jobId;
    }

    @Override
    public String toString() {
        return "ExclusivityToken{jobId='" + jobId + "', held=" + held.get() + "}";
    }
}
