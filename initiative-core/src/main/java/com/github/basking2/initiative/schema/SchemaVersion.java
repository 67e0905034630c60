package com.github.basking2.initiative.schema;

import java.util.Collections;
import java.util.Map;

/**
 * One entry of a {@link SchemaRegistry}: the complete table set in effect from this version on and the
 * optional transform run over existing things when a store is upgraded past it.
 */
public final class SchemaVersion {
    private final int version;
    private final String description;
    private final Map<String, TableDefinition> tables;
    private final ThingTransform transform;

    SchemaVersion(final int version, final String description, final Map<String, TableDefinition> tables, final ThingTransform transform) {
        this.version = version;
        this.description = description;
        this.tables = Collections.unmodifiableMap(tables);
        this.transform = transform;
    }

    public int getVersion() {
        return version;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return Table name to definition, in declaration order.
     */
    public Map<String, TableDefinition> getTables() {
        return tables;
    }

    /**
     * @return The transform, or {@code null} if this version only changes tables.
     */
    public ThingTransform getTransform() {
        return transform;
    }

    public boolean hasTransform() {
        return transform != null;
    }

    @Override
    public String toString() {
        return "SchemaVersion{" + version + " " + description + ", tables=" + tables.values() + (hasTransform() ? ", transform" : "") + "}";
    }
}
