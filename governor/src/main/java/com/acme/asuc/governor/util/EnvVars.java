package com.acme.asuc.governor.util;

import java.util.Map;
import java.util.Objects;

/**
 * Environment lookups with consistent defaulting and clamping.
 *
 * <p>Blank values count as missing. Malformed numbers fall back to the default,
 * out-of-range numbers clamp to the nearest bound.</p>
 */
public final class EnvVars {
    private final Map<String, String> env;

    public EnvVars(Map<String, String> env) {
        this.env = Objects.requireNonNull(env, "env");
    }

    public static EnvVars system() {
        return new EnvVars(System.getenv());
    }

    public int getIntClamped(String name, int defaultValue, int min, int max) {
        return (int) getLongClamped(name, defaultValue, min, max);
    }

    public long getLongClamped(String name, long defaultValue, long min, long max) {
        String raw = raw(name);
        if (raw == null) {
            return defaultValue;
        }
        long parsed;
        try {
            parsed = Long.parseLong(raw);
        } catch (NumberFormatException ignored) {
            return defaultValue;
        }
        return Math.max(min, Math.min(parsed, max));
    }

    public double getDoubleClamped(String name, double defaultValue, double min, double max) {
        String raw = raw(name);
        if (raw == null) {
            return defaultValue;
        }
        double parsed;
        try {
            parsed = Double.parseDouble(raw);
        } catch (NumberFormatException ignored) {
            return defaultValue;
        }
        if (Double.isNaN(parsed)) {
            return defaultValue;
        }
        return Math.max(min, Math.min(parsed, max));
    }

    private String raw(String name) {
        String v = env.get(name);
        return (v == null || v.isBlank()) ? null : v.trim();
    }
}
