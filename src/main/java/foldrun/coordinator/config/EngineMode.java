package foldrun.coordinator.config;

import java.util.Locale;

/**
 * How the folding engine is chosen at startup.
 */
public enum EngineMode {
    /** Real engine when its probe succeeds, stub otherwise */
    AUTO,
    /** Always the stub (degraded mode) */
    STUB;

    public static EngineMode parse(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        try {
            return EngineMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("engine mode must be auto or stub: " + value, e);
        }
    }
}
