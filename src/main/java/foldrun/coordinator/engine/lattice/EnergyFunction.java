package foldrun.coordinator.engine.lattice;

import java.util.List;

/**
 * Coarse-grained C-alpha energy: bond stretching, steric clashes,
 * hydrophobic contact wells and direction restraints.
 */
public final class EnergyFunction {

    static final double BOND_K = 10.0;
    static final double CLASH_DISTANCE = 4.0;
    static final double CLASH_K = 10.0;
    static final double CONTACT_DEPTH = 1.0;
    static final double CONTACT_DISTANCE = 5.5;
    static final double CONTACT_WIDTH = 1.0;

    private static final double MIN_DISTANCE = 1e-9;

    private final List<DirectionConstraint> constraints;

    public EnergyFunction(List<DirectionConstraint> constraints) {
        this.constraints = List.copyOf(constraints);
    }

    public List<DirectionConstraint> constraints() {
        return constraints;
    }

    public double evaluate(Chain chain) {
        return compute(chain, null);
    }

    /**
     * Energy and its gradient with respect to every coordinate.
     *
     * @param gradient output array of the chain's shape, overwritten
     */
    public double evaluate(Chain chain, double[][] gradient) {
        for (double[] g : gradient) {
            g[0] = 0.0;
            g[1] = 0.0;
            g[2] = 0.0;
        }
        return compute(chain, gradient);
    }

    private double compute(Chain chain, double[][] g) {
        double[][] x = chain.positions();
        int n = x.length;
        double e = 0.0;

        for (int i = 0; i < n; i++) {
            boolean hi = chain.residue(i).hydrophobic();
            for (int j = i + 1; j < n; j++) {
                double dx = x[j][0] - x[i][0];
                double dy = x[j][1] - x[i][1];
                double dz = x[j][2] - x[i][2];
                double d = Math.max(Math.sqrt(dx * dx + dy * dy + dz * dz), MIN_DISTANCE);
                int separation = j - i;
                double dEdd = 0.0;

                if (separation == 1) {
                    double s = d - Chain.BOND_LENGTH;
                    e += BOND_K * s * s;
                    dEdd += 2.0 * BOND_K * s;
                } else if (d < CLASH_DISTANCE) {
                    double s = CLASH_DISTANCE - d;
                    e += CLASH_K * s * s;
                    dEdd -= 2.0 * CLASH_K * s;
                }

                if (separation >= 3 && hi && chain.residue(j).hydrophobic()) {
                    double u = (d - CONTACT_DISTANCE) / CONTACT_WIDTH;
                    double w = Math.exp(-0.5 * u * u);
                    e -= CONTACT_DEPTH * w;
                    dEdd += CONTACT_DEPTH * w * u / CONTACT_WIDTH;
                }

                if (g != null && dEdd != 0.0) {
                    double fx = dEdd * dx / d;
                    double fy = dEdd * dy / d;
                    double fz = dEdd * dz / d;
                    g[j][0] += fx;
                    g[j][1] += fy;
                    g[j][2] += fz;
                    g[i][0] -= fx;
                    g[i][1] -= fy;
                    g[i][2] -= fz;
                }
            }
        }

        for (DirectionConstraint c : constraints) {
            int i = c.residue();
            int j = i + 1;
            for (int k = 0; k < 3; k++) {
                double v = x[j][k] - x[i][k] - c.target()[k];
                e += c.weight() * v * v;
                if (g != null) {
                    g[j][k] += 2.0 * c.weight() * v;
                    g[i][k] -= 2.0 * c.weight() * v;
                }
            }
        }

        return e;
    }
}
