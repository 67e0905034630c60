package com.github.basking2.initiativedb;

import com.github.basking2.initiative.StoreOpenException;
import com.github.basking2.initiative.db.InitiativeDbManager;
import com.github.basking2.initiative.schema.InitiativeSchema;
import com.github.basking2.initiativedb.util.App;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * How to configure and open the store.
 */
public class InitiativeDb {
    private static final Logger LOG = LoggerFactory.getLogger(InitiativeDb.class);

    private final Configuration appConfiguration;

    public InitiativeDb() throws ConfigurationException {
        this.appConfiguration = new App(this.getClass()).buildConfiguration();
    }

    public InitiativeDb(final Configuration appConfiguration) {
        this.appConfiguration = appConfiguration;
    }

    public Configuration getConfiguration() {
        return appConfiguration;
    }

    /**
     * @return The configured store directory.
     */
    public String getHome() {
        return appConfiguration.getString("initiativedb.home");
    }

    /**
     * Open the store in the configured home directory.
     */
    public InitiativeDbManager open() throws StoreOpenException {
        return open(getHome());
    }

    /**
     * Open the store in {@code home}, migrating it to the current schema version.
     *
     * @param home The store directory.
     * @return An open store. Close it when done.
     * @throws StoreOpenException if the store cannot be migrated.
     */
    public InitiativeDbManager open(final String home) throws StoreOpenException {
        if (home == null) {
            throw new StoreOpenException("No store directory. Set initiativedb.home.");
        }

        LOG.debug("Opening store in {}.", home);

        return new InitiativeDbManager(
                new File(home),
                InitiativeSchema.registry(),
                InitiativeSchema.CURRENT_VERSION,
                appConfiguration.getString("initiativedb.db.user", InitiativeDbManager.DBADMIN_USER),
                appConfiguration.getString("initiativedb.db.password", InitiativeDbManager.DBADMIN_PASS));
    }
}
