package com.example.i18n.locale;

/**
 * Negotiated locale of a request.
 *
 * @param locale     supported language code
 * @param path       request path without the locale segment, always starting with {@code /}
 * @param fromPath   whether the locale came from the first path segment
 */
public record LocaleMatch(String locale, String path, boolean fromPath) {
}
