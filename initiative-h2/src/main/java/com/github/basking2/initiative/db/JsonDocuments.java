package com.github.basking2.initiative.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.basking2.initiative.Thing;

import java.io.IOException;

/**
 * Rows keep their full record as a JSON document in the {@code data} column. Key columns are copies of
 * top level document fields.
 */
final class JsonDocuments {
    static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonDocuments() {
    }

    static String toJson(final Object value) throws JsonProcessingException {
        return MAPPER.writeValueAsString(value);
    }

    static Thing toThing(final String json) throws IOException {
        return MAPPER.readValue(json, Thing.class);
    }

    static Thing toThing(final ObjectNode document) throws JsonProcessingException {
        return MAPPER.treeToValue(document, Thing.class);
    }

    static ObjectNode toDocument(final Object value) {
        return MAPPER.valueToTree(value);
    }

    static ObjectNode readDocument(final String json) throws IOException {
        final JsonNode node = MAPPER.readTree(json);
        if (!(node instanceof ObjectNode)) {
            throw new IOException("Stored document is not a JSON object: " + json);
        }
        return (ObjectNode) node;
    }

    /**
     * @param document A record.
     * @param field A top level field.
     * @return The text stored in the key column for {@code field}, {@code null} when the field is absent.
     */
    static String keyValue(final ObjectNode document, final String field) {
        final JsonNode node = document.get(field);

        if (node == null || node.isNull()) {
            return null;
        }

        return node.isValueNode() ? node.asText() : node.toString();
    }
}
