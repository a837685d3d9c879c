package com.example.translation.route;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Which namespaces to ship to client code for which routes.
 *
 * <p>Example: {@code always=[common]}, {@code routes={"/indicators/*": [features.indicators]}}
 * ships {@code common.*} everywhere and {@code features.indicators.*} under {@code /indicators}.
 * Route patterns match URL paths, not file layout, so translation files can stay granular.
 */
public final class ClientLoadConfig {

    private final List<String> always;
    private final Map<String, List<String>> routes;
    private final FallbackPolicy fallbackPolicy;
    private final boolean ignoreTrailingSlash;
    private final boolean warnOnOverlap;

    public ClientLoadConfig(List<String> always, Map<String, List<String>> routes, FallbackPolicy fallbackPolicy,
                            boolean ignoreTrailingSlash, boolean warnOnOverlap) {
        this.always = always != null ? List.copyOf(always) : List.of();
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (routes != null) {
            routes.forEach((pattern, namespaces) ->
                    copy.put(pattern, namespaces != null ? List.copyOf(namespaces) : List.of()));
        }
        this.routes = Collections.unmodifiableMap(copy);
        this.fallbackPolicy = fallbackPolicy != null ? fallbackPolicy : FallbackPolicy.ALWAYS_ONLY;
        this.ignoreTrailingSlash = ignoreTrailingSlash;
        this.warnOnOverlap = warnOnOverlap;
    }

    /**
     * Config with the default policy ({@link FallbackPolicy#ALWAYS_ONLY}), no trailing-slash
     * normalization and overlap warnings on.
     */
    public static ClientLoadConfig of(List<String> always, Map<String, List<String>> routes) {
        return new ClientLoadConfig(always, routes, FallbackPolicy.ALWAYS_ONLY, false, true);
    }

    public List<String> getAlways() {
        return always;
    }

    /**
     * Route patterns in the order they are evaluated.
     */
    public Map<String, List<String>> getRoutes() {
        return routes;
    }

    public FallbackPolicy getFallbackPolicy() {
        return fallbackPolicy;
    }

    public boolean isIgnoreTrailingSlash() {
        return ignoreTrailingSlash;
    }

    public boolean isWarnOnOverlap() {
        return warnOnOverlap;
    }
}
