package reportflow.engine.api.v1.dto;

import com.fasterxml.jackson.databind.JsonNode;
import reportflow.engine.model.Run;
import reportflow.engine.model.RunTrigger;
import reportflow.engine.server.RouterHandler;
import reportflow.engine.service.JobChanges;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JSON shape of the run and job DTOs.
 */
class RunResponseTest {

    private static final Instant START = Instant.parse("2024-01-08T09:00:00Z");

    @Test
    @DisplayName("Successful run: outcome fields present, error omitted")
    void successShape() throws Exception {
        Run run = Run.queued("run-1", "job-1", RunTrigger.SCHEDULED, START).toRunning()
                .succeed(3, "/out/a.csv", START.plusSeconds(2));

        JsonNode json = RouterHandler.mapper().readTree(RouterHandler.mapper().writeValueAsString(RunResponse.from(run)));

        assertEquals("run-1", json.get("runId").asText());
        assertEquals("SUCCESS", json.get("state").asText());
        assertEquals("SCHEDULED", json.get("trigger").asText());
        assertEquals(3, json.get("rowCount").asInt());
        assertEquals("2024-01-08T09:00:00Z", json.get("startedAt").asText());
        assertFalse(json.has("error"));
    }

    @Test
    @DisplayName("Failed run: error present, artifact fields omitted")
    void failureShape() throws Exception {
        Run run = Run.queued("run-2", "job-1", RunTrigger.MANUAL, START).toRunning()
                .fail("syntax error near SELECT", START.plusSeconds(1));

        JsonNode json = RouterHandler.mapper().readTree(RouterHandler.mapper().writeValueAsString(RunResponse.from(run)));

        assertEquals("syntax error near SELECT", json.get("error").asText());
        assertFalse(json.has("rowCount"));
        assertFalse(json.has("artifactPath"));
    }

    @Test
    void updateRequestMapsOnlyGivenFields() throws Exception {
        UpdateJobRequest request = RouterHandler.mapper()
                .readValue("{\"schedule\":\"0 8 * * *\",\"unknown\":1}", UpdateJobRequest.class);
        JobChanges changes = request.toChanges();

        assertEquals("0 8 * * *", changes.schedule());
        assertNull(changes.name());
        assertNull(changes.active());
        assertFalse(changes.isEmpty());
    }

    @Test
    void createRequestDefaultsToActive() throws Exception {
        CreateJobRequest request = RouterHandler.mapper()
                .readValue("{\"name\":\"n\",\"query\":\"SELECT 1\",\"schedule\":\"* * * * *\"}", CreateJobRequest.class);
        assertTrue(request.activeOrDefault());
        assertNull(request.outputFormat());
    }
}
