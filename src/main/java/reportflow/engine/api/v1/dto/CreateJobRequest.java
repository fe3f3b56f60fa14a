package reportflow.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for creating a new report job.
 * POST /api/v1/jobs
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CreateJobRequest(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("query") String query,
        @JsonProperty("schedule") String schedule,
        @JsonProperty("outputFormat") String outputFormat,
        @JsonProperty("active") Boolean active) {

    /** Jobs are active unless explicitly disabled */
    public boolean activeOrDefault() {
        return active == null || active;
    }
}
