package com.example.i18n.config;

/**
 * Decides whether a fallback text gets the fallback indicator. Declare a bean of
 * this type to replace the word and letter thresholds of {@code i18n.fallback}.
 */
@FunctionalInterface
public interface FallbackIndicatorPolicy {

    boolean shouldShow(String text, String defaultLocale);

    /**
     * Shows the indicator only for texts with at least {@code minWords} words and
     * {@code minLetters} non-whitespace characters.
     */
    static FallbackIndicatorPolicy minimumLength(int minWords, int minLetters) {
        return (text, defaultLocale) -> {
            String trimmed = text.trim();
            int words = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
            int letters = text.replaceAll("\\s", "").length();
            return words >= minWords && letters >= minLetters;
        };
    }
}
