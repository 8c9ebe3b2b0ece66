package foldrun.coordinator.repository;

import foldrun.coordinator.model.JobInput;
import foldrun.coordinator.model.StatusRecord;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable storage for job inputs, status records and artifacts, keyed by job id.
 *
 * Writes for different job ids never interfere. Status and artifact are two
 * independent writes; a reader may briefly observe one without the other.
 */
public interface JobStore {

    /**
     * Write the input record, replacing any previous input for the same id.
     *
     * @param input the job input
     */
    void putInput(JobInput input);

    /**
     * Read the input record.
     *
     * @param jobId the job ID
     * @return the stored input
     * @throws foldrun.coordinator.model.JobNotFoundException      if no input exists
     * @throws foldrun.coordinator.model.InputUnreadableException if the document is corrupt
     */
    JobInput getInput(String jobId);

    /**
     * Check whether an input was ever written for this id.
     */
    boolean hasInput(String jobId);

    /**
     * Overwrite the status record. Last writer wins.
     */
    void putStatus(StatusRecord status);

    /**
     * Read the status record.
     *
     * @return empty if no status was ever written
     * @throws foldrun.coordinator.model.StatusUnreadableException if the record is corrupt
     */
    Optional<StatusRecord> getStatus(String jobId);

    /**
     * Write the artifact bytes for a job.
     */
    void putArtifact(String jobId, byte[] artifact);

    /**
     * Read the artifact bytes.
     *
     * @return empty if no artifact has been written
     */
    Optional<byte[]> getArtifact(String jobId);

    /**
     * Remove the artifact of a previous run, if any.
     */
    void deleteArtifact(String jobId);

    /**
     * List every job id that has an input or a result container.
     */
    List<String> listJobIds();

    /**
     * Check that the store root is usable.
     */
    boolean isHealthy();

    /**
     * Generate a new unique job ID (128 random bits, 32 hex characters).
     */
    default String generateId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
