package com.example.translation.route;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the namespaces a route needs on the client and slices them out of the
 * request's translation table.
 */
public final class RouteNamespaceSelector {

    private static final Logger log = LoggerFactory.getLogger(RouteNamespaceSelector.class);

    static final char WILDCARD = '*';

    private RouteNamespaceSelector() {
    }

    /**
     * Selects the namespace prefixes for a URL path.
     *
     * <p>Every matching pattern contributes its namespaces after {@code always}. When nothing
     * matches, the config's {@link FallbackPolicy} decides.
     *
     * @param path   routed URL path, without the locale segment
     * @param config client load config; {@code null} selects the whole table
     * @param isDev  whether overlap diagnostics are emitted
     */
    public static NamespaceSelection selectNamespaces(String path, ClientLoadConfig config, boolean isDev) {
        if (config == null) {
            return NamespaceSelection.everything();
        }

        String normalizedPath = config.isIgnoreTrailingSlash() ? normalizePath(path) : path;
        List<String> namespaces = new ArrayList<>(config.getAlways());
        List<String> matchedPatterns = new ArrayList<>();

        for (Map.Entry<String, List<String>> route : config.getRoutes().entrySet()) {
            String pattern = route.getKey();
            String normalizedPattern = config.isIgnoreTrailingSlash() ? normalizePath(pattern) : pattern;
            if (matches(normalizedPath, normalizedPattern)) {
                namespaces.addAll(route.getValue());
                matchedPatterns.add(pattern);
            }
        }

        if (isDev && config.isWarnOnOverlap() && matchedPatterns.size() > 1) {
            log.warn("Multiple client load route patterns matched: path={}, patterns={}", path, matchedPatterns);
        }

        if (matchedPatterns.isEmpty()) {
            switch (config.getFallbackPolicy()) {
                case ALL:
                    return NamespaceSelection.everything();
                case NONE:
                    return NamespaceSelection.skip();
                default:
                    return NamespaceSelection.of(config.getAlways());
            }
        }
        return NamespaceSelection.of(namespaces);
    }

    /**
     * Extracts the entries whose key equals a prefix or lies under {@code prefix + "."}.
     * An empty prefix list returns {@code table} itself.
     */
    public static <V> Map<String, V> extractNamespaces(Map<String, V> table, List<String> namespacePrefixes) {
        if (namespacePrefixes == null || namespacePrefixes.isEmpty()) {
            return table;
        }

        Map<String, V> result = new LinkedHashMap<>();
        for (Map.Entry<String, V> entry : table.entrySet()) {
            if (inAnyNamespace(entry.getKey(), namespacePrefixes)) {
                result.put(entry.getKey(), entry.getValue());
            }
        }
        return result;
    }

    /**
     * Matches a path against a pattern. A pattern without {@code *} must equal the path;
     * with {@code *}, the path must start with the text before the wildcard, or be that
     * text without its trailing slash ({@code /indicators} matches {@code /indicators/*}).
     */
    static boolean matches(String path, String pattern) {
        if (path.equals(pattern)) {
            return true;
        }
        int wildcard = pattern.indexOf(WILDCARD);
        if (wildcard < 0) {
            return false;
        }

        String prefix = pattern.substring(0, wildcard);
        if (path.startsWith(prefix)) {
            return path.length() >= prefix.length() - 1;
        }
        return path.length() == prefix.length() - 1
                && prefix.endsWith("/")
                && prefix.startsWith(path);
    }

    /**
     * Strips one trailing slash; the root path is left alone.
     */
    static String normalizePath(String path) {
        if ("/".equals(path) || !path.endsWith("/")) {
            return path;
        }
        return path.substring(0, path.length() - 1);
    }

    private static boolean inAnyNamespace(String key, List<String> prefixes) {
        for (String prefix : prefixes) {
            if (key.equals(prefix) || key.startsWith(prefix + ".")) {
                return true;
            }
        }
        return false;
    }
}
