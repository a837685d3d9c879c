package com.example.i18n.web;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.servlet.LocaleResolver;

import java.util.Locale;

/**
 * {@link LocaleResolver} reporting the language negotiated by {@link I18nFilter}.
 * The language is changed through the URL, not through this resolver.
 */
public class TranslationLocaleResolver implements LocaleResolver {

    private final Locale defaultLocale;

    public TranslationLocaleResolver(Locale defaultLocale) {
        this.defaultLocale = defaultLocale;
    }

    @Override
    public Locale resolveLocale(HttpServletRequest request) {
        Object state = request.getAttribute(TranslationState.ATTRIBUTE);
        if (state instanceof TranslationState) {
            return Locale.forLanguageTag(((TranslationState) state).locale());
        }
        return defaultLocale;
    }

    @Override
    public void setLocale(HttpServletRequest request, HttpServletResponse response, Locale locale) {
        throw new UnsupportedOperationException(
                "Cannot change the translation locale - select the language with the URL path instead");
    }
}
