package foldrun.coordinator.store.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * On-disk form of a status record ({@code results/<jobId>/status.json}).
 * The error message is always written, as null when absent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StatusDocument(
        String jobId,
        String status,
        String errorMessage,
        Instant updatedAt) {
}
