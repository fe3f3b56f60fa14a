package reportflow.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import reportflow.engine.model.Run;

import java.time.Instant;

/**
 * Response DTO for a run.
 * GET /api/v1/runs/{runId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunResponse(
        @JsonProperty("runId") String runId,
        @JsonProperty("jobId") String jobId,
        @JsonProperty("trigger") String trigger,
        @JsonProperty("state") String state,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt,
        @JsonProperty("rowCount") Integer rowCount,
        @JsonProperty("artifactPath") String artifactPath,
        @JsonProperty("error") String error) {

    public static RunResponse from(Run run) {
        return new RunResponse(
                run.id(),
                run.jobId(),
                run.trigger().name(),
                run.state().name(),
                run.startedAt(),
                run.finishedAt(),
                run.rowCount(),
                run.artifactPath(),
                run.error());
    }
}
