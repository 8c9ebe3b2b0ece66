package foldrun.coordinator.sink;

import foldrun.coordinator.model.JobCompletion;

/**
 * External, non-authoritative mirror of completed results.
 */
public interface PersistenceSink {

    /**
     * Insert or update the mirrored result keyed by job id.
     *
     * @throws PersistenceSinkException if the mirror cannot be written
     */
    void upsert(JobCompletion completion);

    boolean isHealthy();
}
