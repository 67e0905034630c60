package com.github.basking2.initiative.db;

import com.github.basking2.initiative.StoreOpenException;
import com.github.basking2.initiative.schema.SchemaRegistry;
import com.github.basking2.initiative.schema.SchemaVersion;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.configuration.FluentConfiguration;
import org.flywaydb.core.api.migration.JavaMigration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Bring a database up to a target schema version of a {@link SchemaRegistry}.
 *
 * The persisted version is the highest version in Flyway's history table that succeeded. A store with no
 * history is created directly with the target version's tables and no transform runs. Otherwise every
 * registered version above the persisted one, up to the target, is run in ascending order, each as its own
 * Flyway migration.
 */
public class MigrationDriver {
    private static final Logger LOG = LoggerFactory.getLogger(MigrationDriver.class);

    private final SchemaRegistry registry;
    private final String url;
    private final String user;
    private final String password;

    public MigrationDriver(final SchemaRegistry registry, final String url, final String user, final String password) {
        this.registry = registry;
        this.url = url;
        this.user = user;
        this.password = password;
    }

    /**
     * Migrate the database.
     *
     * @param targetVersion A registered version.
     * @return The version the store is at afterwards, always {@code targetVersion}.
     * @throws StoreOpenException if the store is newer than {@code targetVersion} or any migration fails. A
     *     failed migration is rolled back and removed from the history, leaving the store at the last
     *     version that committed.
     * @throws IllegalArgumentException if {@code targetVersion} is not registered.
     */
    public int migrate(final int targetVersion) throws StoreOpenException {
        if (!registry.contains(targetVersion)) {
            throw new IllegalArgumentException("Schema version " + targetVersion + " is not registered.");
        }

        final int persisted = persistedVersion();

        if (persisted > targetVersion) {
            throw new StoreOpenException("Store " + url + " is at schema version " + persisted
                    + " which is newer than the requested version " + targetVersion + ".");
        }

        final List<SchemaMigration> steps = plan(persisted, targetVersion);

        if (steps.isEmpty()) {
            LOG.info("Store {} is at schema version {}.", url, persisted);
            return persisted;
        }

        LOG.info("Migrating store {} from schema version {} to {} in {} steps.", url, persisted, targetVersion, steps.size());

        try {
            configure()
                    .javaMigrations(steps.toArray(new JavaMigration[0]))
                    .load()
                    .migrate();
        }
        catch (final FlywayException e) {
            final StoreOpenException failure = new StoreOpenException(
                    "Migrating store " + url + " from schema version " + persisted + " to " + targetVersion + " failed.", e);

            LOG.error("Migrating store {} failed. Removing the failed entry from the schema history.", url, e);

            try {
                configure()
                        .javaMigrations(history(targetVersion).toArray(new JavaMigration[0]))
                        .load()
                        .repair();
            }
            catch (final FlywayException repairFailure) {
                LOG.error("Repairing the schema history of store {} failed.", url, repairFailure);
                failure.addSuppressed(repairFailure);
            }

            throw failure;
        }

        return targetVersion;
    }

    /**
     * @return The highest successfully applied version, 0 for a new store.
     * @throws StoreOpenException if the history cannot be read.
     */
    public int persistedVersion() throws StoreOpenException {
        final List<Integer> applied = appliedVersions();
        return applied.isEmpty() ? 0 : applied.get(applied.size() - 1);
    }

    /**
     * @return Every successfully applied version, ascending.
     * @throws StoreOpenException if the history cannot be read.
     */
    public List<Integer> appliedVersions() throws StoreOpenException {
        try {
            final List<Integer> versions = new ArrayList<>();

            for (final MigrationInfo info : configure().load().info().applied()) {
                if (info.getVersion() != null && info.getState().isApplied() && !info.getState().isFailed()) {
                    versions.add(Integer.valueOf(info.getVersion().getVersion()));
                }
            }

            Collections.sort(versions);

            return versions;
        }
        catch (final FlywayException e) {
            throw new StoreOpenException("Reading the schema history of store " + url + " failed.", e);
        }
    }

    /**
     * The migrations taking a store from {@code persisted} to {@code target}.
     */
    List<SchemaMigration> plan(final int persisted, final int target) {
        final List<SchemaMigration> steps = new ArrayList<>();

        if (persisted == 0) {
            final SchemaVersion version = registry.get(target);
            steps.add(new SchemaMigration(
                    target,
                    version.getDescription(),
                    Collections.emptyMap(),
                    version.getTables(),
                    null));
            return steps;
        }

        for (final SchemaVersion version : registry.open(target, persisted)) {
            steps.add(new SchemaMigration(
                    version.getVersion(),
                    version.getDescription(),
                    registry.tablesAt(version.getVersion() - 1),
                    version.getTables(),
                    version.getTransform()));
        }

        return steps;
    }

    /**
     * Every registered version up to {@code target}, so Flyway can match each applied history entry to a
     * resolved migration while repairing.
     */
    private List<SchemaMigration> history(final int target) {
        final List<SchemaMigration> migrations = new ArrayList<>();

        for (final SchemaVersion version : registry.open(target, 0)) {
            migrations.add(new SchemaMigration(
                    version.getVersion(),
                    version.getDescription(),
                    registry.tablesAt(version.getVersion() - 1),
                    version.getTables(),
                    version.getTransform()));
        }

        return migrations;
    }

    private FluentConfiguration configure() {
        // Applied versions are not resolved again, so Flyway's validation would report them as missing.
        return Flyway.configure()
                .dataSource(url, user, password)
                .validateOnMigrate(false);
    }
}
