package foldrun.coordinator.engine;

import foldrun.coordinator.config.EngineMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Chooses the engine for a job: the real engine when it is available,
 * the stub otherwise. Falling back is never an error.
 */
public class EngineResolver {

    private static final Logger log = LoggerFactory.getLogger(EngineResolver.class);

    private final FoldingEngine real;
    private final FoldingEngine stub;
    private final EngineMode mode;
    private final AtomicBoolean fallbackLogged = new AtomicBoolean(false);

    public EngineResolver(FoldingEngine real, FoldingEngine stub, EngineMode mode) {
        this.real = real;
        this.stub = stub;
        this.mode = mode;
    }

    /**
     * Engine to use for the next job.
     */
    public FoldingEngine resolve() {
        if (mode == EngineMode.STUB) {
            return stub;
        }
        if (real.isAvailable()) {
            return real;
        }
        if (fallbackLogged.compareAndSet(false, true)) {
            log.warn("Engine '{}' is not available, running in degraded mode with the '{}' engine",
                    real.name(), stub.name());
        }
        return stub;
    }

    /**
     * Engine used when the resolved engine turns out to be unavailable.
     */
    public FoldingEngine fallback() {
        return stub;
    }

    /**
     * Name of the engine new jobs will run on.
     */
    public String activeEngineName() {
        return resolve().name();
    }
}
