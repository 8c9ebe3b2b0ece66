package foldrun.coordinator.engine;

/**
 * Engine preparation failed. Fatal to the job that triggered it, not to the process.
 */
public class EngineInitializationException extends EngineException {

    public EngineInitializationException(String message) {
        super(message);
    }

    public EngineInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
