package reportflow.engine.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model representing a report job: a read-only query,
 * the cron schedule it runs on and the format its results are written in.
 */
public final class Job {
    private final String id;
    private final String name;
    private final String description;
    private final String query;
    private final String schedule; // 5-field cron expression
    private final OutputFormat outputFormat;
    private final boolean active;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.description = builder.description;
        this.query = Objects.requireNonNull(builder.query, "query is required");
        this.schedule = Objects.requireNonNull(builder.schedule, "schedule is required");
        this.outputFormat = Objects.requireNonNull(builder.outputFormat, "outputFormat is required");
        this.active = builder.active;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    // Getters
    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public String query() {
        return query;
    }

    public String schedule() {
        return schedule;
    }

    public OutputFormat outputFormat() {
        return outputFormat;
    }

    public boolean active() {
        return active;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** Create a builder from this job (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .description(description)
                .query(query)
                .schedule(schedule)
                .outputFormat(outputFormat)
                .active(active)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String description;
        private String query;
        private String schedule;
        private OutputFormat outputFormat = OutputFormat.CSV;
        private boolean active = true;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder schedule(String schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder outputFormat(OutputFormat outputFormat) {
            this.outputFormat = outputFormat;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', name='" + name + "', schedule='" + schedule + "', active=" + active + "}";
    }
}
