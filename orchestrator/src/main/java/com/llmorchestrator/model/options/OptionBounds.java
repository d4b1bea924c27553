package com.llmorchestrator.model.options;

import java.util.Collection;
import java.util.Locale;

/**
 * Clamping and enum checks shared by the options classes. Out-of-range numbers are
 * pulled into range rather than rejected; unset values stay {@code null}.
 */
final class OptionBounds {

    static final double MIN_TEMPERATURE = 0.0;
    static final double MAX_TEMPERATURE = 2.0;
    static final double MIN_PENALTY = -2.0;
    static final double MAX_PENALTY = 2.0;

    private OptionBounds() {
    }

    static Double clamp(Double value, double min, double max) {
        if (value == null || value.isNaN()) {
            return null;
        }
        return Math.max(min, Math.min(max, value));
    }

    static Double temperature(Double value) {
        return clamp(value, MIN_TEMPERATURE, MAX_TEMPERATURE);
    }

    static Double topP(Double value) {
        return clamp(value, 0.0, 1.0);
    }

    static Double penalty(Double value) {
        return clamp(value, MIN_PENALTY, MAX_PENALTY);
    }

    static Integer atLeastOne(Integer value) {
        return value == null ? null : Math.max(1, value);
    }

    static String oneOf(String value, Collection<String> allowed, String name) {
        if (value == null) {
            return null;
        }
        String normalized = value.toLowerCase(Locale.ROOT);
        if (!allowed.contains(normalized)) {
            throw new IllegalArgumentException(
                    String.format("%s must be one of %s, got '%s'", name, allowed, value));
        }
        return normalized;
    }
}
