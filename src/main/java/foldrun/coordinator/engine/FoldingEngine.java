package foldrun.coordinator.engine;

/**
 * Computation strategy that turns a sequence into a structure and an energy.
 */
public interface FoldingEngine {

    /**
     * Short name used in logs and in the result mirror.
     */
    String name();

    /**
     * Whether this engine can run in the current process.
     * Probed once at construction and cached.
     */
    boolean isAvailable();

    /**
     * Prepare the engine. Idempotent; only the first successful call does work.
     *
     * @throws EngineUnavailableException    if the engine is not available
     * @throws EngineInitializationException if preparation fails
     */
    void initialize();

    /**
     * Run the requested protocol.
     *
     * @param request sequence, directions and protocol options
     * @return structure bytes and final energy
     * @throws EngineExecutionException if the computation fails
     */
    EngineResult execute(EngineRequest request);
}
