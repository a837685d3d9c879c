package com.example.translation.resolver;

import java.util.Map;

/**
 * Translation data handed to client-side code.
 *
 * @param translations  flat key to value table, usually a namespace subset of the request table
 * @param locale        locale of the request
 * @param defaultLocale default locale of the application
 */
public record ClientPayload(Map<String, Object> translations, String locale, String defaultLocale) {
}
