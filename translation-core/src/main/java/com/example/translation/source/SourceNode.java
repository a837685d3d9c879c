package com.example.translation.source;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parsed node of a translation document: a string leaf, an object branch,
 * or any other JSON value that can never be resolved.
 */
public interface SourceNode {

    record Text(String value) implements SourceNode {
    }

    record Branch(Map<String, SourceNode> children) implements SourceNode {

        public Branch {
            children = Collections.unmodifiableMap(new LinkedHashMap<>(children));
        }

        public static Branch empty() {
            return new Branch(Map.of());
        }
    }

    /**
     * Arrays, numbers, booleans and null.
     */
    record Other(String jsonType) implements SourceNode {
    }
}
