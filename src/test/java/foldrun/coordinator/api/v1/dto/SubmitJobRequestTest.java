package foldrun.coordinator.api.v1.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import foldrun.coordinator.server.RouterHandler;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SubmitJobRequestTest {

    private final ObjectMapper mapper = RouterHandler.mapper();

    @Test
    void deserializeFromJson() throws Exception {
        String json = """
                {
                  "jobId": "fold-1",
                  "sequence": "acde fghik",
                  "directions": ["X", "R", "-"],
                  "params": { "protocol": "fold", "repeats": 3, "seed": 42 }
                }
                """;

        SubmitJobRequest req = mapper.readValue(json, SubmitJobRequest.class);

        assertEquals("fold-1", req.jobId());
        assertEquals("acde fghik", req.sequence());
        assertEquals(List.of("X", "R", "-"), req.directions());
        assertEquals("fold", req.params().get("protocol"));
        assertEquals(3, req.params().get("repeats"));
        assertEquals(42, req.params().get("seed"));
    }

    @Test
    void optionalFieldsMayBeAbsent() throws Exception {
        SubmitJobRequest req = mapper.readValue("{\"sequence\": \"AAAA\"}", SubmitJobRequest.class);

        assertNull(req.jobId());
        assertNull(req.directions());
        assertNull(req.params());
        assertEquals("AAAA", req.sequence());
    }

    @Test
    void unknownFieldsIgnored() throws Exception {
        SubmitJobRequest req = mapper.readValue(
                "{\"sequence\": \"AAAA\", \"priority\": \"high\"}", SubmitJobRequest.class);

        assertEquals("AAAA", req.sequence());
    }
}
