package foldrun.coordinator.engine;

import foldrun.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Degraded-mode engine. Waits a simulated processing delay and returns a
 * fixed single-residue placeholder structure. Not a scientific result.
 */
public final class StubFoldingEngine implements FoldingEngine {

    private static final Logger log = LoggerFactory.getLogger(StubFoldingEngine.class);

    public static final String NAME = "stub";

    public static final double PLACEHOLDER_ENERGY = -10.5;

    public static final String PLACEHOLDER_PDB = String.join("\n",
            "ATOM      1  N   GLY A   1       0.000   0.000   0.000  1.00  0.00           N",
            "ATOM      2  CA  GLY A   1       1.458   0.000   0.000  1.00  0.00           C",
            "ATOM      3  C   GLY A   1       1.958   1.410   0.000  1.00  0.00           C",
            "ATOM      4  O   GLY A   1       1.158   2.330   0.000  1.00  0.00           O",
            "TER",
            "END") + "\n";

    private final Duration delay;

    public StubFoldingEngine(CoordinatorConfig config) {
        this(config.stubDelay());
    }

    public StubFoldingEngine(Duration delay) {
        this.delay = delay;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public void initialize() {
        // nothing to prepare
    }

    @Override
    public EngineResult execute(EngineRequest request) {
        log.debug("Stub engine simulating {}ms of work for {} residues",
                delay.toMillis(), request.sequence().length());
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineExecutionException("interrupted during simulated processing", e);
        }
        return new EngineResult(PLACEHOLDER_PDB.getBytes(StandardCharsets.UTF_8), PLACEHOLDER_ENERGY);
    }
}
