package foldrun.coordinator.engine.lattice;

import java.util.List;

/**
 * C-alpha trace of a chain: one position per residue.
 */
public final class Chain {

    /** C-alpha to C-alpha distance, in angstrom */
    public static final double BOND_LENGTH = 3.8;

    private static final double ZIGZAG_ANGLE = 0.3;

    private final List<Residue> residues;
    private final double[][] positions;

    private Chain(List<Residue> residues, double[][] positions) {
        this.residues = residues;
        this.positions = positions;
    }

    /**
     * Extended zig-zag conformation along x with exact bond lengths.
     */
    public static Chain extended(List<Residue> residues) {
        int n = residues.size();
        double[][] x = new double[n][3];
        double dx = BOND_LENGTH * Math.cos(ZIGZAG_ANGLE);
        double half = BOND_LENGTH * Math.sin(ZIGZAG_ANGLE) / 2.0;
        for (int i = 0; i < n; i++) {
            x[i][0] = i * dx;
            x[i][1] = (i % 2 == 0) ? half : -half;
            x[i][2] = 0.0;
        }
        return new Chain(List.copyOf(residues), x);
    }

    public int size() {
        return positions.length;
    }

    public List<Residue> residues() {
        return residues;
    }

    public Residue residue(int i) {
        return residues.get(i);
    }

    /** Live coordinate array; callers in this package mutate it in place */
    double[][] positions() {
        return positions;
    }

    public double[] position(int i) {
        return positions[i].clone();
    }

    public double distance(int i, int j) {
        double dx = positions[j][0] - positions[i][0];
        double dy = positions[j][1] - positions[i][1];
        double dz = positions[j][2] - positions[i][2];
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }

    public Chain copy() {
        double[][] x = new double[positions.length][];
        for (int i = 0; i < positions.length; i++) {
            x[i] = positions[i].clone();
        }
        return new Chain(residues, x);
    }

    /**
     * Overwrite this chain's coordinates with those of {@code other}.
     */
    public void setFrom(Chain other) {
        if (other.size() != size()) {
            throw new IllegalArgumentException("chain length mismatch");
        }
        for (int i = 0; i < positions.length; i++) {
            System.arraycopy(other.positions[i], 0, positions[i], 0, 3);
        }
    }
}
