package foldrun.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import foldrun.coordinator.model.JobStatus;
import foldrun.coordinator.model.StatusRecord;

/**
 * Response DTO for job status.
 * GET /api/v1/jobs/{jobId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("status") JobStatus status,
        @JsonProperty("errorMessage") String errorMessage) {

    public static JobStatusResponse from(StatusRecord record) {
        return new JobStatusResponse(record.jobId(), record.status(), record.errorMessage());
    }
}
