package com.desweep.core.scanner;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Field access for loosely-typed platform records.
 * <p>
 * A path like {@code DataExtensionTarget.CustomerKey} is first tried as a literal
 * (flattened) key and then as a nested path, since the platform returns both shapes.
 */
final class JsonFields {

    private JsonFields() {}

    static Optional<String> text(JsonNode record, String path) {
        JsonNode value = node(record, path);
        if (value == null || value.isNull() || value.isMissingNode() || value.isContainerNode()) {
            return Optional.empty();
        }
        String text = value.asText();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    /** First present value among {@code paths}. */
    static Optional<String> firstText(JsonNode record, List<String> paths) {
        for (String path : paths) {
            Optional<String> value = text(record, path);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    static JsonNode node(JsonNode record, String path) {
        JsonNode literal = record.get(path);
        if (literal != null || path.indexOf('.') < 0) {
            return literal;
        }
        JsonNode current = record;
        for (String part : path.split("\\.")) {
            current = current.get(part);
            if (current == null) {
                return null;
            }
        }
        return current;
    }
}
