package reportflow.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import reportflow.engine.service.JobChanges;

/**
 * Request DTO for a partial job update; omitted fields stay unchanged.
 * PUT /api/v1/jobs/{jobId}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UpdateJobRequest(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("query") String query,
        @JsonProperty("schedule") String schedule,
        @JsonProperty("outputFormat") String outputFormat,
        @JsonProperty("active") Boolean active) {

    public JobChanges toChanges() {
        return new JobChanges(name, description, query, schedule, outputFormat, active);
    }
}
