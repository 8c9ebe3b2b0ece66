package foldrun.coordinator.engine.lattice;

/**
 * Harmonic restraint pulling residue {@code residue + 1} toward
 * {@code position(residue) + target}.
 *
 * @param residue index of the first residue of the pair
 * @param target  desired offset vector of the next residue
 * @param weight  harmonic weight
 */
public record DirectionConstraint(int residue, double[] target, double weight) {
}
