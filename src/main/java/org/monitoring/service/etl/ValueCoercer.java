package org.monitoring.service.etl;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Best-effort conversion of raw cells. Coercion never fails: anything that is not a
 * canonical number is kept as the original string.
 */
public final class ValueCoercer {

    private static final Pattern CANONICAL_INTEGER = Pattern.compile("^-?(0|[1-9]\\d*)$");
    private static final Pattern CANONICAL_DECIMAL = Pattern.compile("^-?(0|[1-9]\\d*)(\\.\\d+)?([eE][-+]?\\d+)?$");
    private static final Pattern LENIENT_NUMBER = Pattern.compile("^[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?$");

    private ValueCoercer() {
    }

    /**
     * Converts canonical numeric strings to {@link Long} or {@link Double}. Values with leading
     * zeros such as {@code "007"} stay strings.
     */
    public static Object coerce(String raw) {
        if (raw == null) {
            return null;
        }
        if (CANONICAL_INTEGER.matcher(raw).matches()) {
            try {
                return Long.parseLong(raw);
            } catch (NumberFormatException overflow) {
                return raw;
            }
        }
        if (CANONICAL_DECIMAL.matcher(raw).matches()) {
            double value = Double.parseDouble(raw);
            return Double.isFinite(value) ? value : raw;
        }
        return raw;
    }

    /**
     * Parses a measurement or coordinate. Accepts a leading sign and exponent, rejects
     * NaN, infinities and anything Java-specific such as hex or type suffixes.
     */
    public static Optional<Double> parseNumber(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.trim();
        if (!LENIENT_NUMBER.matcher(value).matches()) {
            return Optional.empty();
        }
        double parsed = Double.parseDouble(value);
        return Double.isFinite(parsed) ? Optional.of(parsed) : Optional.empty();
    }

    public static boolean isNumeric(String raw) {
        return parseNumber(raw).isPresent();
    }
}
