package com.example.translation.route;

import java.util.Locale;

/**
 * What to ship to client code when no route pattern matches.
 */
public enum FallbackPolicy {

    /** Ship the whole table. */
    ALL,

    /** Ship nothing and skip injection. */
    NONE,

    /** Ship only the always-loaded namespaces. */
    ALWAYS_ONLY;

    /**
     * Parses {@code all}, {@code none} or {@code always-only} (case-insensitive,
     * {@code _} accepted for {@code -}).
     */
    public static FallbackPolicy from(String value) {
        if (value == null || value.isBlank()) {
            return ALWAYS_ONLY;
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return FallbackPolicy.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown client load fallback policy: " + value, ex);
        }
    }
}
