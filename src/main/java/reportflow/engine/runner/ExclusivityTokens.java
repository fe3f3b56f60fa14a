package reportflow.engine.runner;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registry of exclusivity tokens keyed by job ID. A job keeps the same token
 * for the life of the process, so tokens survive calendar rebuilds and an
 * in-flight run stays guarded across reconciliation.
 */
public final class ExclusivityTokens {

    private final ConcurrentMap<String, ExclusivityToken> tokens = new ConcurrentHashMap<>();

    public ExclusivityToken tokenFor(String jobId) {
        return tokens.computeIfAbsent(jobId, ExclusivityToken::new);
    }

    public boolean isRunning(String jobId) {
        ExclusivityToken token = tokens.get(jobId);
        return token != null && token.isHeld();
    }

    public int runningCount() {
        return (int) tokens.values().stream().filter(ExclusivityToken::isHeld).count();
    }
}
