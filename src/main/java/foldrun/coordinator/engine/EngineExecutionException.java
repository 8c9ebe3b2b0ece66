package foldrun.coordinator.engine;

/**
 * The engine raised while running a protocol.
 */
public class EngineExecutionException extends EngineException {

    public EngineExecutionException(String message) {
        super(message);
    }

    public EngineExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
