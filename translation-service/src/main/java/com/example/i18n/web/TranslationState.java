package com.example.i18n.web;

import com.example.translation.merge.MergedTranslations;
import com.example.translation.resolver.Translator;

/**
 * Translation data of one request, published by {@link I18nFilter}.
 *
 * @param locale        negotiated language
 * @param defaultLocale configured default language
 * @param path          request path without the locale segment
 * @param translations  merged table and fallback keys
 * @param translator    resolver over {@code translations}
 */
public record TranslationState(String locale, String defaultLocale, String path,
                               MergedTranslations translations, Translator translator) {

    public static final String ATTRIBUTE = TranslationState.class.getName();

    public String t(String key) {
        return translator.resolve(key);
    }
}
