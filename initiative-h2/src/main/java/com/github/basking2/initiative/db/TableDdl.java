package com.github.basking2.initiative.db;

import com.github.basking2.initiative.schema.TableDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turn the difference between two table sets into H2 statements.
 *
 * Every table gets one {@code VARCHAR} column per declared key and a {@code data} column holding the record.
 * Unique keys become unique indexes named {@code <table>_<key>_uq}, other keys plain indexes named
 * {@code <table>_<key>_idx}.
 */
final class TableDdl {
    static final String DATA_COLUMN = "data";

    private TableDdl() {
    }

    static Plan plan(final Map<String, TableDefinition> before, final Map<String, TableDefinition> after) {
        final Plan plan = new Plan();

        for (final TableDefinition old : before.values()) {
            if (!after.containsKey(old.getName())) {
                plan.schemaStatements.add("DROP TABLE IF EXISTS " + old.getName());
            }
        }

        for (final TableDefinition table : after.values()) {
            final TableDefinition old = before.get(table.getName());

            if (old == null) {
                plan.schemaStatements.add(createTable(table));
                for (final String key : secondaryKeys(table)) {
                    plan.indexStatements.add(createIndex(table, key));
                }
            }
            else if (!old.equals(table)) {
                alterTable(plan, old, table);
            }
        }

        return plan;
    }

    static String indexName(final String table, final String key, final boolean unique) {
        return table + "_" + key + (unique ? "_uq" : "_idx");
    }

    private static void alterTable(final Plan plan, final TableDefinition old, final TableDefinition table) {
        if (!old.getPrimaryKey().equals(table.getPrimaryKey())) {
            throw new IllegalArgumentException("Changing the primary key of table " + table.getName()
                    + " from " + old.getPrimaryKey() + " to " + table.getPrimaryKey() + " is not supported.");
        }

        final List<String> oldKeys = secondaryKeys(old);
        final List<String> newKeys = secondaryKeys(table);

        final List<String> replacedIndexes = new ArrayList<>();

        for (final String key : oldKeys) {
            if (!newKeys.contains(key)) {
                plan.schemaStatements.add("DROP INDEX IF EXISTS " + indexName(old.getName(), key, old.isUnique(key)));
                plan.schemaStatements.add("ALTER TABLE " + table.getName() + " DROP COLUMN " + key);
            }
            else if (old.isUnique(key) != table.isUnique(key)) {
                // The old index stays until its replacement is built.
                replacedIndexes.add("DROP INDEX IF EXISTS " + indexName(old.getName(), key, old.isUnique(key)));
            }
        }

        for (final String key : newKeys) {
            if (!oldKeys.contains(key)) {
                plan.schemaStatements.add("ALTER TABLE " + table.getName() + " ADD COLUMN " + key + " VARCHAR");
                plan.addedColumns.computeIfAbsent(table.getName(), k -> new ArrayList<>()).add(key);
            }
            if (!oldKeys.contains(key) || old.isUnique(key) != table.isUnique(key)) {
                plan.indexStatements.add(createIndex(table, key));
            }
        }

        plan.indexStatements.addAll(replacedIndexes);
    }

    private static String createTable(final TableDefinition table) {
        final StringBuilder sql = new StringBuilder("CREATE TABLE ")
                .append(table.getName())
                .append(" (")
                .append(table.getPrimaryKey())
                .append(" VARCHAR NOT NULL PRIMARY KEY");

        for (final String key : secondaryKeys(table)) {
            sql.append(", ").append(key).append(" VARCHAR");
        }

        return sql.append(", ").append(DATA_COLUMN).append(" CLOB NOT NULL)").toString();
    }

    private static String createIndex(final TableDefinition table, final String key) {
        final boolean unique = table.isUnique(key);
        return (unique ? "CREATE UNIQUE INDEX " : "CREATE INDEX ")
                + indexName(table.getName(), key, unique)
                + " ON " + table.getName() + " (" + key + ")";
    }

    private static List<String> secondaryKeys(final TableDefinition table) {
        final List<String> keys = table.getKeyColumns();
        return keys.subList(1, keys.size());
    }

    /**
     * Statements are run in three steps: {@link #getSchemaStatements()}, then the back-fill of
     * {@link #getAddedColumns()} from each row's document, then {@link #getIndexStatements()}. Indexes come last
     * so unique indexes are checked against back-filled values. An index whose uniqueness changes is dropped
     * only after its replacement is created, so a failed unique index leaves the previous layout in place.
     */
    static final class Plan {
        private final List<String> schemaStatements = new ArrayList<>();
        private final Map<String, List<String>> addedColumns = new LinkedHashMap<>();
        private final List<String> indexStatements = new ArrayList<>();

        List<String> getSchemaStatements() {
            return Collections.unmodifiableList(schemaStatements);
        }

        Map<String, List<String>> getAddedColumns() {
            return Collections.unmodifiableMap(addedColumns);
        }

        List<String> getIndexStatements() {
            return Collections.unmodifiableList(indexStatements);
        }

        boolean isEmpty() {
            return schemaStatements.isEmpty() && addedColumns.isEmpty() && indexStatements.isEmpty();
        }
    }
}
