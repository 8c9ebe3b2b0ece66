package foldrun.coordinator.engine.lattice;

/**
 * Steepest-descent minimisation with adaptive step length.
 * A step moves the residue with the largest gradient by at most
 * {@code step} angstrom; accepted steps grow it, rejected ones halve it.
 */
public final class Minimizer {

    private static final double INITIAL_STEP = 0.1;
    private static final double MAX_STEP = 1.0;
    private static final double MIN_STEP = 1e-6;
    private static final double GRADIENT_TOLERANCE = 1e-4;

    private final EnergyFunction energy;
    private final int maxSteps;

    public Minimizer(EnergyFunction energy, int maxSteps) {
        this.energy = energy;
        this.maxSteps = maxSteps;
    }

    /**
     * Minimise {@code chain} in place.
     *
     * @return final energy
     */
    public double minimize(Chain chain) {
        int n = chain.size();
        double[][] gradient = new double[n][3];
        double current = energy.evaluate(chain, gradient);
        double step = INITIAL_STEP;
        Chain trial = chain.copy();

        for (int it = 0; it < maxSteps; it++) {
            double gmax = maxComponent(gradient);
            if (gmax < GRADIENT_TOLERANCE) {
                break;
            }

            trial.setFrom(chain);
            double[][] tx = trial.positions();
            double scale = step / gmax;
            for (int i = 0; i < n; i++) {
                tx[i][0] -= scale * gradient[i][0];
                tx[i][1] -= scale * gradient[i][1];
                tx[i][2] -= scale * gradient[i][2];
            }

            double candidate = energy.evaluate(trial);
            if (candidate < current) {
                chain.setFrom(trial);
                current = energy.evaluate(chain, gradient);
                step = Math.min(step * 1.2, MAX_STEP);
            } else {
                step *= 0.5;
                if (step < MIN_STEP) {
                    break;
                }
            }
        }
        return current;
    }

    private static double maxComponent(double[][] gradient) {
        double max = 0.0;
        for (double[] g : gradient) {
            max = Math.max(max, Math.abs(g[0]));
            max = Math.max(max, Math.abs(g[1]));
            max = Math.max(max, Math.abs(g[2]));
        }
        return max;
    }
}
