package foldrun.coordinator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle state of a folding job.
 *
 * queued -> running -> (succeeded | failed). A terminal job only leaves its
 * state when the same id is submitted again, which starts a new lifecycle.
 */
public enum JobStatus {
    /** Input persisted and admitted to the dispatcher, not started yet */
    QUEUED,
    /** Engine invocation in progress */
    RUNNING,
    /** Artifact written, engine finished without error */
    SUCCEEDED,
    /** Engine or input failure, see the error message */
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    /**
     * Check whether a status record may move from this state to {@code next}.
     */
    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case QUEUED -> next == RUNNING || next == FAILED || next == QUEUED;
            case RUNNING -> next == SUCCEEDED || next == FAILED;
            case SUCCEEDED, FAILED -> next == QUEUED;
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JobStatus fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("status is required");
        }
        return JobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
