package com.github.basking2.initiative.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The declared layout of one table: its name, primary key, unique keys and secondary index keys.
 *
 * Each key names a top level field of the records stored in the table. Build one with {@link #table(String)}.
 */
public final class TableDefinition {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String name;
    private final String primaryKey;
    private final Set<String> uniqueKeys;
    private final Set<String> indexKeys;

    private TableDefinition(final String name, final String primaryKey, final Set<String> uniqueKeys, final Set<String> indexKeys) {
        this.name = name;
        this.primaryKey = primaryKey;
        this.uniqueKeys = Collections.unmodifiableSet(uniqueKeys);
        this.indexKeys = Collections.unmodifiableSet(indexKeys);
    }

    public static Builder table(final String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public String getPrimaryKey() {
        return primaryKey;
    }

    public Set<String> getUniqueKeys() {
        return uniqueKeys;
    }

    public Set<String> getIndexKeys() {
        return indexKeys;
    }

    /**
     * @return The primary key followed by the unique keys and then the index keys.
     */
    public List<String> getKeyColumns() {
        final List<String> columns = new ArrayList<>(1 + uniqueKeys.size() + indexKeys.size());
        columns.add(primaryKey);
        columns.addAll(uniqueKeys);
        columns.addAll(indexKeys);
        return columns;
    }

    public boolean isUnique(final String key) {
        return primaryKey.equals(key) || uniqueKeys.contains(key);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TableDefinition)) {
            return false;
        }
        final TableDefinition that = (TableDefinition) o;
        return name.equals(that.name)
                && primaryKey.equals(that.primaryKey)
                && uniqueKeys.equals(that.uniqueKeys)
                && indexKeys.equals(that.indexKeys);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, primaryKey, uniqueKeys, indexKeys);
    }

    @Override
    public String toString() {
        return name + "(&" + primaryKey + ", unique=" + uniqueKeys + ", index=" + indexKeys + ")";
    }

    public static final class Builder {
        private final String name;
        private String primaryKey;
        private final Set<String> uniqueKeys = new LinkedHashSet<>();
        private final Set<String> indexKeys = new LinkedHashSet<>();

        private Builder(final String name) {
            this.name = checkIdentifier(name);
        }

        public Builder primaryKey(final String key) {
            this.primaryKey = checkIdentifier(key);
            return this;
        }

        public Builder unique(final String... keys) {
            for (final String key : keys) {
                uniqueKeys.add(checkIdentifier(key));
            }
            return this;
        }

        public Builder index(final String... keys) {
            for (final String key : keys) {
                indexKeys.add(checkIdentifier(key));
            }
            return this;
        }

        public TableDefinition build() {
            if (primaryKey == null) {
                throw new IllegalArgumentException("Table " + name + " has no primary key.");
            }

            if (uniqueKeys.contains(primaryKey) || indexKeys.contains(primaryKey)) {
                throw new IllegalArgumentException("Table " + name + " declares its primary key " + primaryKey + " twice.");
            }

            for (final String key : uniqueKeys) {
                if (indexKeys.contains(key)) {
                    throw new IllegalArgumentException("Table " + name + " declares " + key + " as both unique and indexed.");
                }
            }

            return new TableDefinition(name, primaryKey, new LinkedHashSet<>(uniqueKeys), new LinkedHashSet<>(indexKeys));
        }

        private static String checkIdentifier(final String identifier) {
            if (identifier == null || !IDENTIFIER.matcher(identifier).matches()) {
                throw new IllegalArgumentException("Not a valid table or key name: " + identifier);
            }
            return identifier;
        }
    }
}
