package foldrun.coordinator.api.v1.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import foldrun.coordinator.model.JobStatus;
import foldrun.coordinator.model.StatusRecord;
import foldrun.coordinator.server.RouterHandler;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResponseDtoTest {

    private final ObjectMapper mapper = RouterHandler.mapper();

    @Test
    void submitResponseIsQueued() throws Exception {
        JsonNode node = mapper.readTree(mapper.writeValueAsString(SubmitJobResponse.queued("abc")));

        assertEquals("abc", node.get("jobId").asText());
        assertEquals("queued", node.get("status").asText());
    }

    @Test
    void statusResponseOmitsMissingError() throws Exception {
        StatusRecord record = new StatusRecord("abc", JobStatus.SUCCEEDED, null, null);
        JsonNode node = mapper.readTree(mapper.writeValueAsString(JobStatusResponse.from(record)));

        assertEquals("succeeded", node.get("status").asText());
        assertFalse(node.has("errorMessage"));
    }

    @Test
    void statusResponseCarriesError() throws Exception {
        StatusRecord record = new StatusRecord("abc", JobStatus.FAILED, "Engine initialization failed: boom", null);
        JsonNode node = mapper.readTree(mapper.writeValueAsString(JobStatusResponse.from(record)));

        assertEquals("failed", node.get("status").asText());
        assertEquals("Engine initialization failed: boom", node.get("errorMessage").asText());
    }

    @Test
    void healthResponseShape() throws Exception {
        JsonNode node = mapper.readTree(mapper.writeValueAsString(HealthResponse.ok("0h 1m", "1.0.0", "stub")));

        assertEquals("ok", node.get("status").asText());
        assertEquals("0h 1m", node.get("uptime").asText());
        assertEquals("1.0.0", node.get("version").asText());
        assertEquals("stub", node.get("engine").asText());
    }
}
