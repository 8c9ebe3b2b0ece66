package foldrun.coordinator.model;

import java.time.Instant;

/**
 * Outcome of a successful job, handed to the result mirror.
 *
 * @param input           the input the run actually used
 * @param artifactContent structure text written to the result area
 * @param energy          final energy, null when the engine reports none
 * @param engine          name of the engine that produced the artifact
 * @param completedAt     time the succeeded status was written
 */
public record JobCompletion(
        JobInput input,
        String artifactContent,
        Double energy,
        String engine,
        Instant completedAt) {

    public String jobId() {
        return input.jobId();
    }
}
