package com.medlake.telegram.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;

/**
 * Produces a JSON-safe copy of a message tree by dropping binary fields at any depth.
 * Field order is preserved and the input tree is left untouched.
 */
@Component
public class RecordNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(RecordNormalizer.class);

    private final JsonNodeFactory nodeFactory = JsonNodeFactory.instance;

    public ObjectNode normalize(ObjectNode record) {
        return normalizeObject(record, "$");
    }

    /**
     * Normalizes any node. Binary roots have no JSON-safe form and come back as {@code null}.
     */
    JsonNode normalize(JsonNode node) {
        return normalizeNode(node, "$");
    }

    private JsonNode normalizeNode(JsonNode node, String path) {
        if (node == null || node.isBinary()) {
            return null;
        }
        if (node.isObject()) {
            return normalizeObject((ObjectNode) node, path);
        }
        if (node.isArray()) {
            return normalizeArray((ArrayNode) node, path);
        }
        // value nodes are immutable, sharing them is safe
        return node;
    }

    private ObjectNode normalizeObject(ObjectNode source, String path) {
        ObjectNode copy = nodeFactory.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String childPath = path + "." + field.getKey();
            JsonNode value = normalizeNode(field.getValue(), childPath);
            if (value == null) {
                logger.debug("Dropped binary field {}", childPath);
                continue;
            }
            copy.set(field.getKey(), value);
        }
        return copy;
    }

    private ArrayNode normalizeArray(ArrayNode source, String path) {
        ArrayNode copy = nodeFactory.arrayNode(source.size());
        for (int i = 0; i < source.size(); i++) {
            String childPath = path + "[" + i + "]";
            JsonNode value = normalizeNode(source.get(i), childPath);
            if (value == null) {
                logger.debug("Dropped binary element {}", childPath);
                continue;
            }
            copy.add(value);
        }
        return copy;
    }
}
