package com.example.translation.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Parses JSON translation documents into {@link SourceNode} trees.
 */
public class SourceDocumentParser {

    private static final Logger log = LoggerFactory.getLogger(SourceDocumentParser.class);

    private final ObjectMapper objectMapper;

    public SourceDocumentParser() {
        this(new ObjectMapper());
    }

    public SourceDocumentParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses a document. Blank, malformed or non-object content yields an empty branch.
     *
     * @param content raw document text
     * @param origin  description of where the text came from, used in diagnostics
     * @return the document root
     */
    public SourceNode.Branch parse(String content, String origin) {
        if (content == null || content.isBlank()) {
            return SourceNode.Branch.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException ex) {
            log.warn("Unparsable translation document ignored: origin={}, error={}", origin, ex.getOriginalMessage());
            return SourceNode.Branch.empty();
        }

        SourceNode node = toNode(root);
        if (node instanceof SourceNode.Branch) {
            return (SourceNode.Branch) node;
        }
        log.warn("Translation document is not an object, ignored: origin={}, type={}", origin, root.getNodeType());
        return SourceNode.Branch.empty();
    }

    private SourceNode toNode(JsonNode node) {
        if (node.isTextual()) {
            return new SourceNode.Text(node.textValue());
        }
        if (node.isObject()) {
            Map<String, SourceNode> children = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                children.put(field.getKey(), toNode(field.getValue()));
            }
            return new SourceNode.Branch(children);
        }
        return new SourceNode.Other(node.getNodeType().name().toLowerCase(Locale.ROOT));
    }
}
