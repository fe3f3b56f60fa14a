package reportflow.engine.service;

/**
 * Partial update of a job definition. Null fields are left unchanged.
 */
public record JobChanges(
        String name,
        String description,
        String query,
        String schedule,
        String outputFormat,
        Boolean active) {

    public static JobChanges activate(boolean active) {
        return new JobChanges(null, null, null, null, null, active);
    }

    public boolean isEmpty() {
        return name == null && description == null && query == null
                && schedule == null && outputFormat == null && active == null;
    }
}
