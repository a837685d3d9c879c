package com.example.translation.resolver;

import java.util.Map;
import java.util.Objects;

/**
 * Factory helpers around {@link Translator}.
 */
public final class Translators {

    private Translators() {
    }

    /**
     * Scopes a translator to a key prefix. {@code namespaced(t, "common.actions").resolve("save")}
     * looks up {@code common.actions.save}; an empty sub-key looks up the prefix itself.
     * Scoped translators compose, and unresolved output always shows the full key.
     */
    public static Translator namespaced(Translator translator, String prefix) {
        Objects.requireNonNull(translator, "translator");
        Objects.requireNonNull(prefix, "prefix");
        return subKey -> translator.resolve(subKey == null || subKey.isEmpty() ? prefix : prefix + "." + subKey);
    }

    /**
     * Rebuilds a translator from a payload shipped to client code. Only the locale
     * settings travel with the payload, so unresolved keys render as {@code [key]}.
     */
    public static Translator fromPayload(ClientPayload payload) {
        Objects.requireNonNull(payload, "payload");
        Map<String, ?> translations = payload.translations() != null ? payload.translations() : Map.of();
        ResolverSettings settings = ResolverSettings.builder()
                .locale(payload.locale())
                .defaultLocale(payload.defaultLocale())
                .build();
        return TranslationResolver.create(translations, null, settings);
    }
}
