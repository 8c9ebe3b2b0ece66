package foldrun.coordinator.engine.lattice;

import java.util.Locale;
import java.util.Optional;

/**
 * Direction tokens of the cubic lattice and their unit vectors.
 */
public enum Direction {
    R(1, 0, 0),
    L(-1, 0, 0),
    U(0, 1, 0),
    D(0, -1, 0),
    F(0, 0, 1),
    B(0, 0, -1);

    private final int dx;
    private final int dy;
    private final int dz;

    Direction(int dx, int dy, int dz) {
        this.dx = dx;
        this.dy = dy;
        this.dz = dz;
    }

    /**
     * Unit vector scaled to {@code length}.
     */
    public double[] scaled(double length) {
        return new double[] { dx * length, dy * length, dz * length };
    }

    /**
     * Parse a token case-insensitively. Empty for anything but R, L, U, D, F, B.
     */
    public static Optional<Direction> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String t = token.trim().toUpperCase(Locale.ROOT);
        for (Direction d : values()) {
            if (d.name().equals(t)) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }
}
