package foldrun.coordinator.model;

/**
 * The persisted status record exists but cannot be parsed. A server fault, not a client error.
 */
public class StatusUnreadableException extends RuntimeException {

    public StatusUnreadableException(String message) {
        super(message);
    }

    public StatusUnreadableException(String message, Throwable cause) {
        super(message, cause);
    }
}
