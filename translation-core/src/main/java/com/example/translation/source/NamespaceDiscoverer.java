package com.example.translation.source;

import com.example.translation.common.TranslationSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Discovers the translation documents of one locale directory and derives
 * their namespaces from the relative file path.
 *
 * <p>Directory layout example:
 * <pre>
 * locales/en/common.json                     -> common
 * locales/en/common/actions.json             -> common.actions
 * locales/en/features/navigator/dashboard.json -> features.navigator.dashboard
 * locales/en/pdi-modals.json                 -> pdiModals
 * </pre>
 *
 * <p>Entries are visited in lexicographic name order; when two documents map
 * to the same namespace the one visited last wins.
 */
public class NamespaceDiscoverer {

    private static final Logger log = LoggerFactory.getLogger(NamespaceDiscoverer.class);

    static final String EXTENSION = ".json";

    private static final Pattern WORD_SEPARATOR = Pattern.compile("[-_]([A-Za-z])");

    private final SourceTreeReader reader;

    public NamespaceDiscoverer(SourceTreeReader reader) {
        this.reader = reader;
    }

    public Map<String, Path> discover(Path rootDir) {
        Map<String, Path> files = new LinkedHashMap<>();
        visit(rootDir, new ArrayList<>(), files);
        log.debug("Translation files discovered: root={}, count={}", rootDir, files.size());
        return files;
    }

    private void visit(Path directory, List<String> segments, Map<String, Path> files) {
        List<SourceEntry> entries;
        try {
            entries = new ArrayList<>(reader.list(directory));
        } catch (TranslationSourceException ex) {
            log.error("Error discovering translation files: directory={}, error={}",
                    directory, ex.getCause() != null ? ex.getCause().toString() : ex.getMessage());
            return;
        }
        entries.sort(Comparator.comparing(SourceEntry::name));

        for (SourceEntry entry : entries) {
            if (entry.file() && entry.name().endsWith(EXTENSION)) {
                List<String> path = new ArrayList<>(segments);
                path.add(entry.name().substring(0, entry.name().length() - EXTENSION.length()));
                String namespace = toNamespace(path);
                Path previous = files.put(namespace, entry.path());
                if (previous != null) {
                    log.debug("Namespace collision, later file wins: namespace={}, replaced={}, winner={}",
                            namespace, previous, entry.path());
                }
            } else if (entry.directory()) {
                List<String> path = new ArrayList<>(segments);
                path.add(entry.name());
                visit(entry.path(), path, files);
            }
        }
    }

    static String toNamespace(List<String> segments) {
        List<String> camelized = new ArrayList<>(segments.size());
        for (String segment : segments) {
            camelized.add(toCamelCase(segment));
        }
        return String.join(".", camelized);
    }

    /**
     * Converts kebab-case or snake_case to camelCase: {@code pdi-modals} becomes
     * {@code pdiModals}, {@code user_settings} becomes {@code userSettings}.
     */
    static String toCamelCase(String segment) {
        Matcher matcher = WORD_SEPARATOR.matcher(segment);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, matcher.group(1).toUpperCase(Locale.ROOT));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
