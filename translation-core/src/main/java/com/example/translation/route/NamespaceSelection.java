package com.example.translation.route;

import java.util.List;

/**
 * Outcome of route namespace selection.
 *
 * <p>{@link #skip()} means no client payload at all. Otherwise {@link #getNamespaces()}
 * lists the namespace prefixes to extract, where an empty list means the whole table.
 */
public final class NamespaceSelection {

    private static final NamespaceSelection SKIP = new NamespaceSelection(true, List.of());
    private static final NamespaceSelection EVERYTHING = new NamespaceSelection(false, List.of());

    private final boolean skip;
    private final List<String> namespaces;

    private NamespaceSelection(boolean skip, List<String> namespaces) {
        this.skip = skip;
        this.namespaces = namespaces;
    }

    public static NamespaceSelection skip() {
        return SKIP;
    }

    public static NamespaceSelection everything() {
        return EVERYTHING;
    }

    public static NamespaceSelection of(List<String> namespaces) {
        return namespaces.isEmpty() ? EVERYTHING : new NamespaceSelection(false, List.copyOf(namespaces));
    }

    public boolean isSkip() {
        return skip;
    }

    public boolean isEverything() {
        return !skip && namespaces.isEmpty();
    }

    public List<String> getNamespaces() {
        return namespaces;
    }

    @Override
    public String toString() {
        if (skip) {
            return "NamespaceSelection{skip}";
        }
        return isEverything() ? "NamespaceSelection{everything}" : "NamespaceSelection" + namespaces;
    }
}
