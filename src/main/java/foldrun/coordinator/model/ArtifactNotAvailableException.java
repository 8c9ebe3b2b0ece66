package foldrun.coordinator.model;

/**
 * No artifact has been written for the job yet, whatever its status.
 */
public class ArtifactNotAvailableException extends RuntimeException {

    public ArtifactNotAvailableException(String message) {
        super(message);
    }

    public ArtifactNotAvailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
