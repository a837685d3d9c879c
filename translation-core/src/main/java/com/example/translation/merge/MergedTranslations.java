package com.example.translation.merge;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Flat translation table of one request plus the keys whose value was borrowed
 * from the default locale. Both views are read-only.
 */
public final class MergedTranslations {

    private static final MergedTranslations EMPTY = new MergedTranslations(Map.of(), Set.of());

    private final Map<String, String> table;
    private final Set<String> fallbackKeys;

    private MergedTranslations(Map<String, String> table, Set<String> fallbackKeys) {
        this.table = Collections.unmodifiableMap(table);
        this.fallbackKeys = Collections.unmodifiableSet(fallbackKeys);
    }

    public static MergedTranslations empty() {
        return EMPTY;
    }

    /**
     * Overlays the active-locale entries on the default-locale entries.
     *
     * <p>A key written by the default pass is a fallback key until the active pass
     * writes the same key. With {@code fallbackEnabled} false the default entries
     * are ignored and no fallback key is ever recorded.
     *
     * @param defaultEntries  ordered entries of the default locale
     * @param activeEntries   ordered entries of the requested locale
     * @param fallbackEnabled whether default-locale values may fill gaps
     */
    public static MergedTranslations fold(Iterable<Map.Entry<String, String>> defaultEntries,
                                          Iterable<Map.Entry<String, String>> activeEntries,
                                          boolean fallbackEnabled) {
        Map<String, String> table = new LinkedHashMap<>();
        Set<String> fallbackKeys = new LinkedHashSet<>();

        if (fallbackEnabled) {
            for (Map.Entry<String, String> entry : defaultEntries) {
                boolean existed = table.containsKey(entry.getKey());
                table.put(entry.getKey(), entry.getValue());
                if (!existed) {
                    fallbackKeys.add(entry.getKey());
                }
            }
        }

        for (Map.Entry<String, String> entry : activeEntries) {
            boolean existed = table.containsKey(entry.getKey());
            table.put(entry.getKey(), entry.getValue());
            if (fallbackEnabled && existed) {
                fallbackKeys.remove(entry.getKey());
            }
        }

        return new MergedTranslations(table, fallbackKeys);
    }

    public Map<String, String> getTable() {
        return table;
    }

    public Set<String> getFallbackKeys() {
        return fallbackKeys;
    }

    public boolean isFallback(String key) {
        return fallbackKeys.contains(key);
    }

    public int size() {
        return table.size();
    }

    @Override
    public String toString() {
        return "MergedTranslations{keys=" + table.size() + ", fallbackKeys=" + fallbackKeys.size() + "}";
    }
}
