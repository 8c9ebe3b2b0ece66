package foldrun.coordinator.engine.lattice;

/**
 * Residue type as seen by the coarse-grained model.
 *
 * @param code        one-letter code
 * @param name        three-letter PDB residue name
 * @param hydrophobic whether the residue takes part in contact wells
 */
public record Residue(char code, String name, boolean hydrophobic) {
}
