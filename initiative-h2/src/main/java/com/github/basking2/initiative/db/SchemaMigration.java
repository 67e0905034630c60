package com.github.basking2.initiative.db;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.basking2.initiative.Thing;
import com.github.basking2.initiative.schema.TableDefinition;
import com.github.basking2.initiative.schema.ThingTransform;
import org.flywaydb.core.api.MigrationVersion;
import org.flywaydb.core.api.migration.Context;
import org.flywaydb.core.api.migration.JavaMigration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One schema version handed to Flyway.
 *
 * Flyway runs {@link #migrate(Context)} in a transaction and records the version in its history table when it
 * commits. The migration moves the tables from the previous version's set to this version's set and then, if
 * there is a transform, rewrites every row of the {@code things} table.
 */
class SchemaMigration implements JavaMigration {
    private static final Logger LOG = LoggerFactory.getLogger(SchemaMigration.class);

    private final int version;
    private final String description;
    private final Map<String, TableDefinition> before;
    private final Map<String, TableDefinition> after;
    private final ThingTransform transform;

    /**
     * @param version The version recorded once this migration commits.
     * @param description Recorded with the version.
     * @param before The tables the store has now.
     * @param after The tables the store has at {@code version}.
     * @param transform Applied to every thing, or {@code null}.
     */
    SchemaMigration(
            final int version,
            final String description,
            final Map<String, TableDefinition> before,
            final Map<String, TableDefinition> after,
            final ThingTransform transform
    ) {
        this.version = version;
        this.description = description;
        this.before = before;
        this.after = after;
        this.transform = transform;
    }

    @Override
    public MigrationVersion getVersion() {
        return MigrationVersion.fromVersion(Integer.toString(version));
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public Integer getChecksum() {
        return null;
    }

    public boolean isUndo() {
        return false;
    }

    public boolean isBaselineMigration() {
        return false;
    }

    @Override
    public boolean canExecuteInTransaction() {
        return true;
    }

    ThingTransform getTransform() {
        return transform;
    }

    @Override
    public void migrate(final Context context) throws Exception {
        final Connection connection = context.getConnection();
        final TableDdl.Plan plan = TableDdl.plan(before, after);

        LOG.info("Migrating to schema version {}: {}", version, description);

        execute(connection, plan.getSchemaStatements());

        for (final Map.Entry<String, List<String>> added : plan.getAddedColumns().entrySet()) {
            LOG.info("Back-filling columns {} of table {}.", added.getValue(), added.getKey());
            rewriteRows(connection, after.get(added.getKey()), null);
        }

        execute(connection, plan.getIndexStatements());

        if (transform != null) {
            final TableDefinition things = after.get(Thing.TABLE);

            if (things == null) {
                throw new IllegalStateException("Schema version " + version + " has a transform but no " + Thing.TABLE + " table.");
            }

            final int count = rewriteRows(connection, things, transform);
            LOG.info("Transformed {} things for schema version {}.", count, version);
        }
    }

    private void execute(final Connection connection, final List<String> statements) throws SQLException {
        try (final Statement statement = connection.createStatement()) {
            for (final String sql : statements) {
                LOG.debug("Schema version {}: {}", version, sql);
                statement.execute(sql);
            }
        }
    }

    /**
     * Rewrite each row's document, optionally through {@code thingTransform}, and refresh its key columns.
     *
     * @return The number of rows rewritten.
     */
    private int rewriteRows(final Connection connection, final TableDefinition table, final ThingTransform thingTransform) throws Exception {
        final String primaryKey = table.getPrimaryKey();
        final Map<String, String> rows = new LinkedHashMap<>();

        try (
                final PreparedStatement select = connection.prepareStatement(
                        "SELECT " + primaryKey + ", " + TableDdl.DATA_COLUMN + " FROM " + table.getName() + " ORDER BY " + primaryKey);
                final ResultSet resultSet = select.executeQuery()
        ) {
            while (resultSet.next()) {
                rows.put(resultSet.getString(1), resultSet.getString(2));
            }
        }

        final List<String> columns = table.getKeyColumns();
        final StringBuilder sql = new StringBuilder("UPDATE ").append(table.getName()).append(" SET ");
        for (final String column : columns) {
            sql.append(column).append(" = ?, ");
        }
        sql.append(TableDdl.DATA_COLUMN).append(" = ? WHERE ").append(primaryKey).append(" = ?");

        try (final PreparedStatement update = connection.prepareStatement(sql.toString())) {
            for (final Map.Entry<String, String> row : rows.entrySet()) {
                ObjectNode document = JsonDocuments.readDocument(row.getValue());

                if (thingTransform != null) {
                    final Thing thing = thingTransform.apply(JsonDocuments.toThing(document));
                    document = JsonDocuments.toDocument(thing);
                }

                int i = 1;
                for (final String column : columns) {
                    update.setString(i++, JsonDocuments.keyValue(document, column));
                }
                update.setString(i++, JsonDocuments.toJson(document));
                update.setString(i, row.getKey());
                update.addBatch();
            }

            update.executeBatch();
        }

        return rows.size();
    }
}
