package com.github.basking2.initiative.db;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.basking2.initiative.StoreResult;
import com.github.basking2.initiative.Thing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * The accessors a client application uses.
 *
 * Failures are not reported beyond {@code false} or an absent ({@code null}) value: a missing record and a
 * storage fault look the same here. Use {@link ThingMyBatis} and {@link KeyValueMyBatis} directly to see the
 * cause.
 */
public class InitiativeStore {
    private static final Logger LOG = LoggerFactory.getLogger(InitiativeStore.class);

    static final String EXPORT_COMMENT = "This document is exported from an initiative store. The format is not "
            + "versioned; older exports are imported on a best effort basis.";

    private final ThingMyBatis things;
    private final KeyValueMyBatis keyValues;

    public InitiativeStore(final ThingMyBatis things, final KeyValueMyBatis keyValues) {
        this.things = things;
        this.keyValues = keyValues;
    }

    /**
     * @return Every thing, ordered by uuid. Empty if the things cannot be read.
     */
    public List<Thing> getAllThings() {
        return things.all().orElse(Collections.emptyList());
    }

    /**
     * @return The thing or {@code null}.
     */
    public Thing getThing(final String uuid) {
        return things.get(uuid).orElse(null);
    }

    /**
     * @return The thing with this name or {@code null}.
     */
    public Thing getThingByName(final String name) {
        return things.getByName(name).orElse(null);
    }

    /**
     * @return {@code false} if the thing has no uuid, another thing has its name, or storage failed.
     */
    public boolean saveThing(final Thing thing) {
        return things.put(thing).isOk();
    }

    public boolean deleteThing(final String uuid) {
        return things.delete(uuid).isOk();
    }

    /**
     * @return The value decoded to plain Java types (String, Number, Boolean, List, Map) or {@code null}.
     */
    public Object getValue(final String key) {
        return getValue(key, Object.class);
    }

    /**
     * @return The value converted to {@code type}, or {@code null} if it is absent or does not convert.
     */
    public <T> T getValue(final String key, final Class<T> type) {
        final JsonNode value = keyValues.get(key).orElse(null);

        if (value == null || value.isMissingNode()) {
            return null;
        }

        try {
            return JsonDocuments.MAPPER.convertValue(value, type);
        }
        catch (final IllegalArgumentException e) {
            LOG.warn("Value {} is not a {}.", key, type.getSimpleName(), e);
            return null;
        }
    }

    public boolean setValue(final String key, final Object value) {
        final JsonNode node;
        try {
            node = JsonDocuments.MAPPER.valueToTree(value);
        }
        catch (final IllegalArgumentException e) {
            LOG.warn("Value {} cannot be stored as JSON.", key, e);
            return false;
        }

        return keyValues.put(key, node).isOk();
    }

    public boolean deleteValue(final String key) {
        return keyValues.delete(key).isOk();
    }

    /**
     * @return {@code {"_": comment, "things": [...], "keyValue": {...}}}. Parts that cannot be read are empty.
     */
    public ObjectNode export() {
        final ObjectNode document = JsonDocuments.MAPPER.createObjectNode();
        document.put("_", EXPORT_COMMENT);

        final ArrayNode thingArray = document.putArray("things");
        for (final Thing thing : getAllThings()) {
            thingArray.add(JsonDocuments.toDocument(thing));
        }

        final ObjectNode keyValueObject = document.putObject("keyValue");
        for (final Map.Entry<String, JsonNode> entry : keyValues.all().orElse(Collections.emptyMap()).entrySet()) {
            keyValueObject.set(entry.getKey(), entry.getValue());
        }

        return document;
    }

    /**
     * Save the things and settings of an {@link #export()} document. A rejected entry does not stop the rest.
     *
     * @param document An exported document.
     * @return How many entries were saved and how many were rejected.
     * @throws IllegalArgumentException if {@code document} is not an object.
     */
    public ImportResult importDocument(final JsonNode document) {
        if (document == null || !document.isObject()) {
            throw new IllegalArgumentException("An import document must be a JSON object.");
        }

        int imported = 0;
        int rejected = 0;

        for (final JsonNode node : document.path("things")) {
            Thing thing = null;
            if (node.isObject()) {
                try {
                    thing = JsonDocuments.toThing((ObjectNode) node);
                }
                catch (final IOException e) {
                    LOG.warn("Skipping thing that does not decode: {}", node, e);
                }
            }

            if (thing != null && saveThing(thing)) {
                imported++;
            }
            else {
                rejected++;
            }
        }

        for (final Iterator<Map.Entry<String, JsonNode>> i = document.path("keyValue").fields(); i.hasNext(); ) {
            final Map.Entry<String, JsonNode> entry = i.next();
            if (keyValues.put(entry.getKey(), entry.getValue()).isOk()) {
                imported++;
            }
            else {
                rejected++;
            }
        }

        LOG.info("Imported {} entries, rejected {}.", imported, rejected);

        return new ImportResult(imported, rejected);
    }

    /**
     * Direct access to the things, with failure causes.
     */
    public ThingMyBatis getThings() {
        return things;
    }

    /**
     * Direct access to the settings, with failure causes.
     */
    public KeyValueMyBatis getKeyValues() {
        return keyValues;
    }

    public static final class ImportResult {
        private final int imported;
        private final int rejected;

        public ImportResult(final int imported, final int rejected) {
            this.imported = imported;
            this.rejected = rejected;
        }

        public int getImported() {
            return imported;
        }

        public int getRejected() {
            return rejected;
        }

        @Override
        public String toString() {
            return "imported=" + imported + ", rejected=" + rejected;
        }
    }
}
