package reportflow.engine.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of one execution attempt of a job.
 *
 * <p>The constructor enforces the state invariants:</p>
 * <ul>
 * <li>{@code finishedAt} is set iff the state is terminal</li>
 * <li>{@code rowCount} and {@code artifactPath} are set iff the state is SUCCESS</li>
 * <li>{@code error} is set iff the state is FAILED</li>
 * </ul>
 *
 * Transitions return a new instance and go through {@link RunState#requireTransition}.
 */
public final class Run {
    private final String id;
    private final String jobId;
    private final RunTrigger trigger;
    private final RunState state;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final Integer rowCount;
    private final String artifactPath;
    private final String error;

    private Run(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.jobId = Objects.requireNonNull(builder.jobId, "jobId is required");
        this.trigger = Objects.requireNonNull(builder.trigger, "trigger is required");
        this.state = Objects.requireNonNull(builder.state, "state is required");
        this.startedAt = Objects.requireNonNull(builder.startedAt, "startedAt is required");
        this.finishedAt = builder.finishedAt;
        this.rowCount = builder.rowCount;
        this.artifactPath = builder.artifactPath;
        this.error = builder.error;
        checkInvariants();
    }

    private void checkInvariants() {
        boolean terminal = state.isTerminal();
        if (terminal != (finishedAt != null)) {
            throw new IllegalStateException("finishedAt must be set iff run is terminal: " + this);
        }
        boolean success = state == RunState.SUCCESS;
        if (success != (rowCount != null) || success != (artifactPath != null)) {
            throw new IllegalStateException("rowCount/artifactPath must be set iff run succeeded: " + this);
        }
        if ((state == RunState.FAILED) != (error != null)) {
            throw new IllegalStateException("error must be set iff run failed: " + this);
        }
        if (finishedAt != null && finishedAt.isBefore(startedAt)) {
            throw new IllegalStateException("finishedAt before startedAt: " + this);
        }
    }

    /** New run in QUEUED state */
    public static Run queued(String id, String jobId, RunTrigger trigger, Instant startedAt) {
        return builder()
                .id(id)
                .jobId(jobId)
                .trigger(trigger)
                .state(RunState.QUEUED)
                .startedAt(startedAt)
                .build();
    }

    public Run toRunning() {
        state.requireTransition(RunState.RUNNING);
        return toBuilder().state(RunState.RUNNING).build();
    }

    public Run succeed(int rowCount, String artifactPath, Instant finishedAt) {
        state.requireTransition(RunState.SUCCESS);
        return toBuilder()
                .state(RunState.SUCCESS)
                .rowCount(rowCount)
                .artifactPath(artifactPath)
                .finishedAt(finishedAt)
                .build();
    }

    public Run fail(String error, Instant finishedAt) {
        state.requireTransition(RunState.FAILED);
        return toBuilder()
                .state(RunState.FAILED)
                .error(error)
                .finishedAt(finishedAt)
                .build();
    }

    // Getters
    public String id() {
        return id;
    }

    public String jobId() {
        return jobId;
    }

    public RunTrigger trigger() {
        return trigger;
    }

    public RunState state() {
        return state;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public Integer rowCount() {
        return rowCount;
    }

    public String artifactPath() {
        return artifactPath;
    }

    public String error() {
        return error;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .jobId(jobId)
                .trigger(trigger)
                .state(state)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .rowCount(rowCount)
                .artifactPath(artifactPath)
                .error(error);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String jobId;
        private RunTrigger trigger = RunTrigger.MANUAL;
        private RunState state = RunState.QUEUED;
        private Instant startedAt;
        private Instant finishedAt;
        private Integer rowCount;
        private String artifactPath;
        private String error;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder trigger(RunTrigger trigger) {
            this.trigger = trigger;
            return this;
        }

        public Builder state(RunState state) {
            this.state = state;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Builder rowCount(Integer rowCount) {
            this.rowCount = rowCount;
            return this;
        }

        public Builder artifactPath(String artifactPath) {
            this.artifactPath = artifactPath;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Run build() {
            return new Run(this);
        }
    }

    /** Same terminal outcome, used by idempotent updates */
    public boolean sameOutcome(Run other) {
        return other != null
                && id.equals(other.id)
                && state == other.state
                && Objects.equals(rowCount, other.rowCount)
                && Objects.equals(artifactPath, other.artifactPath)
                && Objects.equals(error, other.error);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Run run))
            return false;
        return Objects.equals(id, run.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Run{id='" + id + "', jobId='" + jobId + "', state=" + state + "}";
    }
}
