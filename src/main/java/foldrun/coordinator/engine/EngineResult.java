package foldrun.coordinator.engine;

/**
 * Engine output.
 *
 * @param artifact serialized structure (PDB text)
 * @param energy   final energy, null when not evaluated
 */
public record EngineResult(byte[] artifact, Double energy) {
}
