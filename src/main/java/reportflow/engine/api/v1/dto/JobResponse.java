package reportflow.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import reportflow.engine.model.Job;

import java.time.Instant;

/**
 * Response DTO for job details.
 * GET /api/v1/jobs/{jobId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("query") String query,
        @JsonProperty("schedule") String schedule,
        @JsonProperty("outputFormat") String outputFormat,
        @JsonProperty("active") boolean active,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt,
        @JsonProperty("nextFireAt") Instant nextFireAt) {

    /** Create response from domain model; nextFireAt is null when the job is not on the calendar */
    public static JobResponse from(Job job, Instant nextFireAt) {
        return new JobResponse(
                job.id(),
                job.name(),
                job.description(),
                job.query(),
                job.schedule(),
                job.outputFormat().name(),
                job.active(),
                job.createdAt(),
                job.updatedAt(),
                nextFireAt);
    }
}
