package com.example.translation.merge;

import com.example.translation.common.TranslationSourceException;
import com.example.translation.source.KeyFlattener;
import com.example.translation.source.NamespaceDiscoverer;
import com.example.translation.source.SourceDocumentParser;
import com.example.translation.source.SourceNode;
import com.example.translation.source.SourceTreeReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the per-request translation table for a locale, optionally filling
 * gaps from the default locale.
 *
 * <p>The default locale is loaded first and the requested locale is laid over
 * it, so the requested locale always wins. Instances hold no per-request state
 * and can be shared between concurrent requests.
 */
public class LocaleMerger {

    private static final Logger log = LoggerFactory.getLogger(LocaleMerger.class);

    private final NamespaceDiscoverer discoverer;
    private final SourceTreeReader reader;
    private final SourceDocumentParser parser;

    public LocaleMerger(NamespaceDiscoverer discoverer, SourceTreeReader reader, SourceDocumentParser parser) {
        this.discoverer = discoverer;
        this.reader = reader;
        this.parser = parser;
    }

    /**
     * Merges the locale folders {@code localesDir/activeLocale} and
     * {@code localesDir/defaultLocale}. The default pass is skipped when both codes are equal.
     */
    public MergedTranslations merge(Path localesDir, String activeLocale, String defaultLocale,
                                    boolean fallbackEnabled) {
        Path defaultRoot = defaultLocale == null || defaultLocale.equals(activeLocale)
                ? null
                : localesDir.resolve(defaultLocale);
        return merge(localesDir.resolve(activeLocale), defaultRoot, fallbackEnabled);
    }

    /**
     * Merges two locale roots.
     *
     * @param activeLocaleRoot  folder of the requested locale
     * @param defaultLocaleRoot folder of the default locale, or {@code null}
     * @param fallbackEnabled   whether default-locale values fill gaps of the requested locale
     * @return the merged table and its fallback keys
     */
    public MergedTranslations merge(Path activeLocaleRoot, Path defaultLocaleRoot, boolean fallbackEnabled) {
        Objects.requireNonNull(activeLocaleRoot, "activeLocaleRoot");

        List<Map.Entry<String, String>> defaultEntries = List.of();
        if (fallbackEnabled && defaultLocaleRoot != null
                && !defaultLocaleRoot.normalize().equals(activeLocaleRoot.normalize())) {
            defaultEntries = load(defaultLocaleRoot);
        }
        List<Map.Entry<String, String>> activeEntries = load(activeLocaleRoot);

        MergedTranslations merged = MergedTranslations.fold(defaultEntries, activeEntries, fallbackEnabled);
        log.debug("Translations merged: activeRoot={}, defaultRoot={}, fallbackEnabled={}, keys={}, fallbackKeys={}",
                activeLocaleRoot, defaultLocaleRoot, fallbackEnabled, merged.size(), merged.getFallbackKeys().size());
        return merged;
    }

    /**
     * Reads every document of a locale root into namespaced (key, value) pairs,
     * in discovery order.
     */
    List<Map.Entry<String, String>> load(Path localeRoot) {
        List<Map.Entry<String, String>> entries = new ArrayList<>();
        for (Map.Entry<String, Path> source : discoverer.discover(localeRoot).entrySet()) {
            String namespace = source.getKey();
            for (Map.Entry<String, String> leaf : KeyFlattener.flatten(readDocument(source.getValue())).entrySet()) {
                entries.add(new AbstractMap.SimpleImmutableEntry<>(namespace + "." + leaf.getKey(), leaf.getValue()));
            }
        }
        return entries;
    }

    private SourceNode readDocument(Path document) {
        try {
            return parser.parse(reader.read(document), document.toString());
        } catch (TranslationSourceException ex) {
            log.warn("Translation file unreadable, treated as empty: file={}, error={}",
                    document, ex.getCause() != null ? ex.getCause().toString() : ex.getMessage());
            return SourceNode.Branch.empty();
        }
    }
}
