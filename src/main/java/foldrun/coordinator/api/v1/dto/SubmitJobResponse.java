package foldrun.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import foldrun.coordinator.model.JobStatus;

/**
 * Response DTO for an accepted submission.
 */
public record SubmitJobResponse(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("status") JobStatus status) {

    public static SubmitJobResponse queued(String jobId) {
        return new SubmitJobResponse(jobId, JobStatus.QUEUED);
    }
}
