package foldrun.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("engine") String engine) {

    public static HealthResponse ok(String uptime, String version, String engine) {
        return new HealthResponse("ok", uptime, version, engine);
    }
}
