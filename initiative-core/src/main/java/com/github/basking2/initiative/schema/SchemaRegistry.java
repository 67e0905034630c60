package com.github.basking2.initiative.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Every schema version a store has ever had, in ascending order.
 *
 * Versions must be registered in strictly increasing order. Gaps are allowed. The registry only declares and
 * filters; applying versions to a live store is the job of the storage layer.
 */
public class SchemaRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(SchemaRegistry.class);

    private final TreeMap<Integer, SchemaVersion> versions = new TreeMap<>();

    public SchemaRegistry register(final int version, final List<TableDefinition> tables) {
        return register(version, "schema version " + version, tables, null);
    }

    public SchemaRegistry register(final int version, final List<TableDefinition> tables, final ThingTransform transform) {
        return register(version, "schema version " + version, tables, transform);
    }

    /**
     * Declare a schema version.
     *
     * @param version The version number. Must be positive and greater than every version already registered.
     * @param description Recorded in the store's migration history.
     * @param tables The complete table set in effect from this version on.
     * @param transform Run over every existing thing when upgrading past this version. May be {@code null}.
     * @return this.
     * @throws IllegalArgumentException if the version is out of order or a table is declared twice.
     */
    public SchemaRegistry register(final int version, final String description, final List<TableDefinition> tables, final ThingTransform transform) {
        if (version < 1) {
            throw new IllegalArgumentException("Schema versions start at 1, not " + version + ".");
        }

        if (!versions.isEmpty() && version <= versions.lastKey()) {
            throw new IllegalArgumentException("Schema version " + version + " is not greater than version " + versions.lastKey() + ".");
        }

        final Map<String, TableDefinition> byName = new LinkedHashMap<>();
        for (final TableDefinition table : tables) {
            if (byName.put(table.getName(), table) != null) {
                throw new IllegalArgumentException("Schema version " + version + " declares table " + table.getName() + " twice.");
            }
        }

        versions.put(version, new SchemaVersion(version, description, byName, transform));
        LOG.debug("Registered schema version {}: {}", version, description);

        return this;
    }

    /**
     * Select the versions a store must go through.
     *
     * @param targetVersion The version being opened.
     * @param persistedVersion The version the store was last committed at, 0 for none.
     * @return Every version {@code v} with {@code persistedVersion < v <= targetVersion}, ascending.
     */
    public List<SchemaVersion> open(final int targetVersion, final int persistedVersion) {
        if (targetVersion <= persistedVersion) {
            return Collections.emptyList();
        }

        return new ArrayList<>(versions.subMap(persistedVersion, false, targetVersion, true).values());
    }

    /**
     * @return The highest registered version, 0 if nothing is registered.
     */
    public int latestVersion() {
        return versions.isEmpty() ? 0 : versions.lastKey();
    }

    /**
     * @param version A version number.
     * @return The registered version or {@code null}.
     */
    public SchemaVersion get(final int version) {
        return versions.get(version);
    }

    public boolean contains(final int version) {
        return versions.containsKey(version);
    }

    /**
     * The tables a store at {@code version} has. That is the table set of the highest registered version not
     * above {@code version}.
     *
     * @param version A version number, registered or not.
     * @return Table name to definition. Empty below the first registered version.
     */
    public Map<String, TableDefinition> tablesAt(final int version) {
        final Map.Entry<Integer, SchemaVersion> entry = versions.floorEntry(version);

        if (entry == null) {
            return Collections.emptyMap();
        }

        return entry.getValue().getTables();
    }

    /**
     * @return All registered versions, ascending.
     */
    public List<SchemaVersion> versions() {
        return new ArrayList<>(versions.values());
    }
}
