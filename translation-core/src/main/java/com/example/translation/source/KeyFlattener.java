package com.example.translation.source;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flattens a document tree into dot-joined keys. Only string leaves are kept.
 */
public final class KeyFlattener {

    private KeyFlattener() {
    }

    public static Map<String, String> flatten(SourceNode document) {
        Map<String, String> flattened = new LinkedHashMap<>();
        collect(document, "", flattened);
        return flattened;
    }

    private static void collect(SourceNode node, String prefix, Map<String, String> out) {
        if (node instanceof SourceNode.Branch) {
            for (Map.Entry<String, SourceNode> child : ((SourceNode.Branch) node).children().entrySet()) {
                SourceNode value = child.getValue();
                if (value instanceof SourceNode.Branch) {
                    collect(value, prefix + child.getKey() + ".", out);
                } else if (value instanceof SourceNode.Text) {
                    out.put(prefix + child.getKey(), ((SourceNode.Text) value).value());
                }
                // Other leaves cannot be resolved and are dropped
            }
        }
    }
}
