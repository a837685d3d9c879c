package com.example.translation.resolver;

import com.example.translation.merge.MergedTranslations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Creates {@link Translator}s over a flat translation table.
 *
 * <p>Resolution rules:
 * <ul>
 *     <li>Missing key or non-string value: {@code [key]} during development (with a warning),
 *     empty string in production unless {@code showKeysInProd} is set.</li>
 *     <li>String value borrowed from the default locale: decorated with the fallback
 *     indicator in production when the indicator is enabled and fully configured.</li>
 *     <li>Any other string value: returned as is.</li>
 * </ul>
 */
public final class TranslationResolver {

    private static final Logger log = LoggerFactory.getLogger(TranslationResolver.class);

    private TranslationResolver() {
    }

    public static Translator create(MergedTranslations translations, ResolverSettings settings) {
        return create(translations.getTable(), translations.getFallbackKeys(), settings);
    }

    /**
     * @param table        flat key to value table; values that are not strings are reported as wrong type
     * @param fallbackKeys keys whose value comes from the default locale, may be {@code null}
     * @param settings     behavior options, may be {@code null}
     */
    public static Translator create(Map<String, ?> table, Set<String> fallbackKeys, ResolverSettings settings) {
        ResolverSettings config = settings != null ? settings : ResolverSettings.defaults();
        Set<String> fallbacks = fallbackKeys != null ? fallbackKeys : Set.of();
        boolean prod = config.useProductionBehavior();
        String localeInfo = config.getLocale() != null ? " [locale: " + config.getLocale() + "]" : "";

        return key -> {
            if (!table.containsKey(key)) {
                if (!prod) {
                    log.warn("Missing translation key: \"{}\"{}", key, localeInfo);
                }
                return unresolved(key, prod, config);
            }

            Object value = table.get(key);
            if (!(value instanceof String)) {
                if (!prod) {
                    log.warn("Translation key \"{}\" exists but is not a string value{}: got {} ({}), root keys={}",
                            key, localeInfo, typeName(value), value, rootKeys(table));
                }
                return unresolved(key, prod, config);
            }

            String text = (String) value;
            if (prod
                    && config.isShowFallbackIndicator()
                    && fallbacks.contains(key)
                    && config.getDefaultLocale() != null
                    && config.getFallbackIndicatorFormat() != null) {
                if (config.getShouldShowFallbackIndicator() == null
                        || config.getShouldShowFallbackIndicator().test(text, config.getDefaultLocale())) {
                    return config.getFallbackIndicatorFormat().apply(text, config.getDefaultLocale());
                }
            }
            return text;
        };
    }

    private static String unresolved(String key, boolean prod, ResolverSettings config) {
        if (!prod || config.isShowKeysInProd()) {
            return "[" + key + "]";
        }
        return "";
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    private static Set<String> rootKeys(Map<String, ?> table) {
        Set<String> roots = new TreeSet<>();
        for (String key : table.keySet()) {
            int dot = key.indexOf('.');
            roots.add(dot < 0 ? key : key.substring(0, dot));
        }
        return roots;
    }
}
