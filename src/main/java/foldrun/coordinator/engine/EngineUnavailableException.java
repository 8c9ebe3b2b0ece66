package foldrun.coordinator.engine;

/**
 * The selected engine cannot run in this process. Callers fall back to the stub.
 */
public class EngineUnavailableException extends EngineException {

    public EngineUnavailableException(String message) {
        super(message);
    }

    public EngineUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
