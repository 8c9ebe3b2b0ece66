package foldrun.coordinator.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Typed protocol options of a job.
 *
 * @param protocol         folding protocol, relax by default
 * @param repeats          positive repeat count, 1 by default
 * @param seed             optional seed for reproducible runs
 * @param biasToDirections whether direction tokens become constraints, true by default
 */
public record JobParams(
        Protocol protocol,
        int repeats,
        String seed,
        boolean biasToDirections) {

    private static final Logger log = LoggerFactory.getLogger(JobParams.class);

    public static final int MAX_REPEATS = 1000;

    private static final Set<String> KNOWN_KEYS = Set.of("protocol", "repeats", "seed", "biasToDirections");

    public JobParams {
        if (protocol == null) {
            protocol = Protocol.DEFAULT;
        }
        if (repeats < 1 || repeats > MAX_REPEATS) {
            throw new JobValidationException("repeats must be between 1 and " + MAX_REPEATS + ", got " + repeats);
        }
        if (seed != null && seed.isBlank()) {
            seed = null;
        }
    }

    public static JobParams defaults() {
        return new JobParams(Protocol.DEFAULT, 1, null, true);
    }

    /**
     * Build typed params from the loosely-typed request map.
     * Unknown keys are ignored.
     */
    public static JobParams from(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return defaults();
        }

        for (String key : raw.keySet()) {
            if (!KNOWN_KEYS.contains(key)) {
                log.debug("Ignoring unknown job param '{}'", key);
            }
        }

        Protocol protocol = parseProtocol(raw.get("protocol"));
        int repeats = parseRepeats(raw.get("repeats"));
        String seed = parseSeed(raw.get("seed"));
        boolean bias = parseBias(raw.get("biasToDirections"));

        return new JobParams(protocol, repeats, seed, bias);
    }

    /** Map form used for the on-disk input document */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("protocol", protocol.wireName());
        map.put("repeats", repeats);
        if (seed != null) {
            map.put("seed", seed);
        }
        map.put("biasToDirections", biasToDirections);
        return map;
    }

    private static Protocol parseProtocol(Object value) {
        if (value == null) {
            return Protocol.DEFAULT;
        }
        if (!(value instanceof String s)) {
            throw new JobValidationException("protocol must be a string");
        }
        return Protocol.parse(s);
    }

    private static int parseRepeats(Object value) {
        if (value == null) {
            return 1;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            long l = ((Number) value).longValue();
            if (l < 1 || l > MAX_REPEATS) {
                throw new JobValidationException("repeats must be between 1 and " + MAX_REPEATS + ", got " + l);
            }
            return (int) l;
        }
        if (value instanceof Number n) {
            BigDecimal d = new BigDecimal(n.toString());
            if (d.stripTrailingZeros().scale() > 0) {
                throw new JobValidationException("repeats must be a whole number, got " + n);
            }
            return parseRepeats(d.longValue());
        }
        throw new JobValidationException("repeats must be a positive integer");
    }

    private static String parseSeed(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String s) {
            return s.trim();
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof java.math.BigInteger) {
            return value.toString();
        }
        throw new JobValidationException("seed must be a string or an integer");
    }

    private static boolean parseBias(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        throw new JobValidationException("biasToDirections must be a boolean");
    }
}
