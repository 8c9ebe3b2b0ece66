package foldrun.coordinator.model;

/**
 * A job submission was rejected before any state was written.
 */
public class JobValidationException extends IllegalArgumentException {

    public JobValidationException(String message) {
        super(message);
    }

    public JobValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
