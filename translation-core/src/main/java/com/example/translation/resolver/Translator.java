package com.example.translation.resolver;

/**
 * Resolves a translation key to display text. Never returns {@code null}.
 */
@FunctionalInterface
public interface Translator {

    String resolve(String key);

    /**
     * Returns a translator that prepends {@code prefix} to every key.
     *
     * @see Translators#namespaced(Translator, String)
     */
    default Translator namespaced(String prefix) {
        return Translators.namespaced(this, prefix);
    }
}
