package foldrun.coordinator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Folding protocol requested for a job.
 */
public enum Protocol {
    /** Iterative energy minimisation, repeated {@code repeats} times */
    RELAX,
    /** Metropolis Monte Carlo over {@code repeats x 100} trial moves */
    FOLD,
    /** Evaluate the starting structure without moving it */
    SCORE;

    public static final Protocol DEFAULT = RELAX;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Protocol parse(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        for (Protocol p : values()) {
            if (p.name().equalsIgnoreCase(value.trim())) {
                return p;
            }
        }
        throw new JobValidationException("unknown protocol: " + value + " (expected relax, fold or score)");
    }
}
