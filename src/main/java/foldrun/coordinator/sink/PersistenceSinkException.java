package foldrun.coordinator.sink;

/**
 * Failure writing to the result mirror. Always logged and swallowed.
 */
public class PersistenceSinkException extends RuntimeException {

    public PersistenceSinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
