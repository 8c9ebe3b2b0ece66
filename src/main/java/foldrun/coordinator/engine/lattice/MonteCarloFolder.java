package foldrun.coordinator.engine.lattice;

import java.util.Random;

/**
 * Metropolis Monte Carlo over bond-preserving moves:
 * pivot (rotate the tail about one residue) and crankshaft
 * (rotate one residue about the axis through its neighbours).
 * The lowest-energy conformation seen is restored at the end.
 */
public final class MonteCarloFolder {

    public static final double TEMPERATURE = 2.0;

    private static final double PIVOT_SIGMA = 0.35;
    private static final double CRANKSHAFT_SIGMA = 0.6;

    private final EnergyFunction energy;
    private final Random random;

    public MonteCarloFolder(EnergyFunction energy, Random random) {
        this.energy = energy;
        this.random = random;
    }

    /**
     * Run {@code moves} trial moves on {@code chain} in place.
     *
     * @return energy of the recovered lowest-energy conformation
     */
    public double fold(Chain chain, int moves) {
        double current = energy.evaluate(chain);
        Chain best = chain.copy();
        double bestEnergy = current;
        Chain trial = chain.copy();

        for (int m = 0; m < moves; m++) {
            trial.setFrom(chain);
            if (!perturb(trial)) {
                continue;
            }
            double candidate = energy.evaluate(trial);
            if (accept(current, candidate)) {
                chain.setFrom(trial);
                current = candidate;
                if (current < bestEnergy) {
                    best.setFrom(chain);
                    bestEnergy = current;
                }
            }
        }

        chain.setFrom(best);
        return bestEnergy;
    }

    boolean accept(double current, double candidate) {
        if (candidate <= current) {
            return true;
        }
        return random.nextDouble() < Math.exp((current - candidate) / TEMPERATURE);
    }

    private boolean perturb(Chain chain) {
        int n = chain.size();
        if (n < 2) {
            return false;
        }
        if (n < 3 || random.nextBoolean()) {
            int pivot = random.nextInt(n - 1);
            double[] axis = randomAxis();
            double angle = random.nextGaussian() * PIVOT_SIGMA;
            double[][] x = chain.positions();
            for (int i = pivot + 1; i < n; i++) {
                rotate(x[i], x[pivot], axis, angle);
            }
            return true;
        }

        int i = 1 + random.nextInt(n - 2);
        double[][] x = chain.positions();
        double[] axis = {
                x[i + 1][0] - x[i - 1][0],
                x[i + 1][1] - x[i - 1][1],
                x[i + 1][2] - x[i - 1][2] };
        if (!normalize(axis)) {
            return false;
        }
        rotate(x[i], x[i - 1], axis, random.nextGaussian() * CRANKSHAFT_SIGMA);
        return true;
    }

    private double[] randomAxis() {
        double[] axis = new double[3];
        do {
            axis[0] = random.nextGaussian();
            axis[1] = random.nextGaussian();
            axis[2] = random.nextGaussian();
        } while (!normalize(axis));
        return axis;
    }

    private static boolean normalize(double[] v) {
        double len = Math.sqrt(v[0] * v[0] + v[1] * v[1] + v[2] * v[2]);
        if (len < 1e-9) {
            return false;
        }
        v[0] /= len;
        v[1] /= len;
        v[2] /= len;
        return true;
    }

    /**
     * Rodrigues rotation of {@code p} about the unit {@code axis} through {@code origin}.
     */
    static void rotate(double[] p, double[] origin, double[] axis, double angle) {
        double vx = p[0] - origin[0];
        double vy = p[1] - origin[1];
        double vz = p[2] - origin[2];
        double cos = Math.cos(angle);
        double sin = Math.sin(angle);
        double dot = axis[0] * vx + axis[1] * vy + axis[2] * vz;
        double cx = axis[1] * vz - axis[2] * vy;
        double cy = axis[2] * vx - axis[0] * vz;
        double cz = axis[0] * vy - axis[1] * vx;
        p[0] = origin[0] + vx * cos + cx * sin + axis[0] * dot * (1 - cos);
        p[1] = origin[1] + vy * cos + cy * sin + axis[1] * dot * (1 - cos);
        p[2] = origin[2] + vz * cos + cz * sin + axis[2] * dot * (1 - cos);
    }
}
