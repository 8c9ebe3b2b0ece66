package foldrun.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for submitting a job.
 * POST /api/v1/jobs
 */
public record SubmitJobRequest(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("sequence") String sequence,
        @JsonProperty("directions") List<String> directions,
        @JsonProperty("params") Map<String, Object> params) {
}
