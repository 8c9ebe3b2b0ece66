package foldrun.coordinator.engine;

import foldrun.coordinator.config.CoordinatorConfig;
import foldrun.coordinator.config.EngineMode;
import foldrun.coordinator.engine.lattice.Chain;
import foldrun.coordinator.engine.lattice.Direction;
import foldrun.coordinator.engine.lattice.DirectionConstraint;
import foldrun.coordinator.engine.lattice.EnergyFunction;
import foldrun.coordinator.engine.lattice.Minimizer;
import foldrun.coordinator.engine.lattice.MonteCarloFolder;
import foldrun.coordinator.engine.lattice.PdbWriter;
import foldrun.coordinator.engine.lattice.Residue;
import foldrun.coordinator.engine.lattice.ResidueTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

/**
 * Coarse-grained C-alpha folding engine.
 *
 * Builds an extended chain from the sequence, optionally restrains
 * consecutive residues along the requested direction tokens, then runs
 * one of the protocols:
 * <ul>
 * <li>relax - {@code repeats} rounds of steepest-descent minimisation</li>
 * <li>fold - {@code repeats x 100} Metropolis moves at kT = 2.0, lowest state kept</li>
 * <li>score - evaluate the starting structure</li>
 * </ul>
 */
public final class LatticeFoldingEngine implements FoldingEngine {

    private static final Logger log = LoggerFactory.getLogger(LatticeFoldingEngine.class);

    public static final String NAME = "lattice";
    public static final String DEFAULT_RESIDUE_TABLE = "foldrun/engine/residues.properties";

    static final double CONSTRAINT_WEIGHT = 5.0;
    static final int MOVES_PER_REPEAT = 100;

    private static final Pattern INTEGER_SEED = Pattern.compile("^-?\\d{1,18}$");

    private final String residueTableResource;
    private final int relaxSteps;
    private final boolean available;
    private final Object initLock = new Object();

    private volatile ResidueTable residueTable;

    public LatticeFoldingEngine(CoordinatorConfig config) {
        this(DEFAULT_RESIDUE_TABLE, config.relaxSteps(), config.engineMode() != EngineMode.STUB);
    }

    public LatticeFoldingEngine(String residueTableResource, int relaxSteps, boolean enabled) {
        this.residueTableResource = residueTableResource;
        this.relaxSteps = relaxSteps;
        this.available = enabled && probe(residueTableResource);
        log.info("Engine '{}' available: {}", NAME, available);
    }

    private static boolean probe(String resource) {
        return LatticeFoldingEngine.class.getClassLoader().getResource(resource) != null;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    /**
     * Whether {@link #initialize()} has completed successfully.
     */
    public boolean isReady() {
        return residueTable != null;
    }

    @Override
    public void initialize() {
        if (residueTable != null) {
            return;
        }
        synchronized (initLock) {
            if (residueTable != null) {
                return;
            }
            if (!available) {
                throw new EngineUnavailableException("engine '" + NAME + "' is not available");
            }
            try {
                ResidueTable table = ResidueTable.load(residueTableResource);
                residueTable = table;
                log.info("Engine '{}' initialized with {} residue types", NAME, table.size());
            } catch (IOException | RuntimeException e) {
                throw new EngineInitializationException(
                        "failed to initialize engine '" + NAME + "': " + e.getMessage(), e);
            }
        }
    }

    @Override
    public EngineResult execute(EngineRequest request) {
        initialize();

        try {
            List<Residue> residues = residueTable.classify(request.sequence());
            Chain chain = Chain.extended(residues);

            List<DirectionConstraint> constraints = List.of();
            if (request.biasToDirections() && !request.directions().isEmpty()) {
                constraints = buildConstraints(request.directions(), chain.size());
            }
            EnergyFunction energy = new EnergyFunction(constraints);

            double finalEnergy = switch (request.protocol()) {
                case RELAX -> relax(chain, energy, request.repeats());
                case FOLD -> fold(chain, energy, request.repeats(), request.seed());
                case SCORE -> energy.evaluate(chain);
            };

            log.debug("Engine '{}' finished {} for {} residues, energy {}",
                    NAME, request.protocol().wireName(), chain.size(), finalEnergy);

            String pdb = PdbWriter.write(chain, request.protocol().wireName(), finalEnergy);
            return new EngineResult(pdb.getBytes(StandardCharsets.UTF_8), finalEnergy);
        } catch (EngineException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EngineExecutionException(e.getMessage() != null ? e.getMessage() : e.toString(), e);
        }
    }

    private double relax(Chain chain, EnergyFunction energy, int repeats) {
        Minimizer minimizer = new Minimizer(energy, relaxSteps);
        double e = energy.evaluate(chain);
        for (int r = 0; r < repeats; r++) {
            e = minimizer.minimize(chain);
        }
        return e;
    }

    private double fold(Chain chain, EnergyFunction energy, int repeats, String seed) {
        Random random = new Random(resolveSeed(seed));
        return new MonteCarloFolder(energy, random).fold(chain, repeats * MOVES_PER_REPEAT);
    }

    /**
     * Restraints from direction tokens: token i pulls residue i+1 toward
     * residue i plus one bond length along the token's lattice vector.
     * Unknown tokens are skipped; a failure drops the bias, not the job.
     */
    List<DirectionConstraint> buildConstraints(List<String> directions, int residues) {
        List<DirectionConstraint> constraints = new ArrayList<>();
        try {
            for (int i = 0; i < directions.size(); i++) {
                if (i + 1 >= residues) {
                    break;
                }
                String token = directions.get(i);
                Optional<Direction> direction = Direction.fromToken(token);
                if (direction.isEmpty()) {
                    log.warn("Unknown direction '{}' at position {}, skipping", token, i);
                    continue;
                }
                constraints.add(new DirectionConstraint(
                        i, direction.get().scaled(Chain.BOND_LENGTH), CONSTRAINT_WEIGHT));
            }
            log.debug("Applied {} directional constraints", constraints.size());
            return constraints;
        } catch (RuntimeException e) {
            log.warn("Could not apply directional constraints, continuing without bias: {}", e.getMessage());
            return List.of();
        }
    }

    /**
     * Integer seeds are used as-is, other strings are hashed.
     * No seed means a fresh random one.
     */
    static long resolveSeed(String seed) {
        if (seed == null) {
            return ThreadLocalRandom.current().nextLong();
        }
        if (INTEGER_SEED.matcher(seed).matches()) {
            return Long.parseLong(seed);
        }
        return seed.hashCode() & 0x7fffffffL;
    }
}
