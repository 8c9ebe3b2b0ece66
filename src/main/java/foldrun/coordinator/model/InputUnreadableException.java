package foldrun.coordinator.model;

/**
 * The input document of a job is missing or cannot be parsed.
 */
public class InputUnreadableException extends JobStoreException {

    public InputUnreadableException(String message) {
        super(message);
    }

    public InputUnreadableException(String message, Throwable cause) {
        super(message, cause);
    }
}
