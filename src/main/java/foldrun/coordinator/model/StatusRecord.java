package foldrun.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Current status of a job as persisted in the result area.
 *
 * @param jobId        job identifier
 * @param status       lifecycle state
 * @param errorMessage human-readable failure reason, only for {@link JobStatus#FAILED}
 * @param updatedAt    time of the write, may be null for synthesised records
 */
public record StatusRecord(
        String jobId,
        JobStatus status,
        String errorMessage,
        Instant updatedAt) {

    public StatusRecord {
        Objects.requireNonNull(jobId, "jobId is required");
        Objects.requireNonNull(status, "status is required");
    }

    public static StatusRecord queued(String jobId) {
        return new StatusRecord(jobId, JobStatus.QUEUED, null, Instant.now());
    }

    public static StatusRecord running(String jobId) {
        return new StatusRecord(jobId, JobStatus.RUNNING, null, Instant.now());
    }

    public static StatusRecord succeeded(String jobId) {
        return new StatusRecord(jobId, JobStatus.SUCCEEDED, null, Instant.now());
    }

    public static StatusRecord failed(String jobId, String errorMessage) {
        return new StatusRecord(jobId, JobStatus.FAILED, errorMessage, Instant.now());
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
