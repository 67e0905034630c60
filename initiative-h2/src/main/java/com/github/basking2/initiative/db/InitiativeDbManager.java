package com.github.basking2.initiative.db;

import java.io.File;

import com.github.basking2.initiative.StoreOpenException;
import com.github.basking2.initiative.schema.InitiativeSchema;
import com.github.basking2.initiative.schema.SchemaRegistry;
import org.apache.ibatis.datasource.pooled.PooledDataSource;
import org.apache.ibatis.mapping.Environment;
import org.apache.ibatis.session.Configuration;
import org.apache.ibatis.session.SqlSessionFactoryBuilder;
import org.apache.ibatis.session.SqlSessionManager;
import org.apache.ibatis.transaction.TransactionFactory;
import org.apache.ibatis.transaction.jdbc.JdbcTransactionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manage opening, migrating and building database related resources.
 *
 * Construction blocks until the store is migrated to the requested schema version. If migration fails the
 * constructor throws and no sessions are ever handed out.
 */
public class InitiativeDbManager implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(InitiativeDbManager.class);

    public static final String DBADMIN_USER = "initiative_admin";
    public static final String DBADMIN_PASS = "";

    private final File where;
    private final int schemaVersion;
    private final PooledDataSource dataSource;
    private final SqlSessionManager sqlSessionManager;

    public InitiativeDbManager(final String where) throws StoreOpenException
    {
        this(new File(where));
    }

    /**
     * Open the store at the current schema version.
     *
     * @param where The directory holding the store. The database files live in {@code where/db}.
     *
     * @throws StoreOpenException when the store cannot be migrated.
     */
    public InitiativeDbManager(final File where) throws StoreOpenException
    {
        this(where, InitiativeSchema.registry(), InitiativeSchema.CURRENT_VERSION, DBADMIN_USER, DBADMIN_PASS);
    }

    /**
     * Open a store.
     *
     * @param where The directory holding the store. The database files live in {@code where/db}.
     * @param registry The schema history.
     * @param targetVersion A version of {@code registry} to migrate to.
     * @param user Database user.
     * @param password Database password.
     *
     * @throws StoreOpenException when the store cannot be migrated.
     */
    public InitiativeDbManager(
            final File where,
            final SchemaRegistry registry,
            final int targetVersion,
            final String user,
            final String password
    ) throws StoreOpenException
    {
        this.where = new File(where, "db");

        this.schemaVersion = new MigrationDriver(registry, url(false), user, password).migrate(targetVersion);

        this.dataSource = new PooledDataSource("org.h2.Driver", url(true), user, password);

        final TransactionFactory transactionFactory = new JdbcTransactionFactory();
        final Environment        environment        = new Environment("initiative", transactionFactory, dataSource);
        final Configuration      configuration      = new Configuration(environment);

        configuration.addMapper(ThingMapper.class);
        configuration.addMapper(KeyValueMapper.class);

        sqlSessionManager =
                SqlSessionManager.newInstance(
                        new SqlSessionFactoryBuilder().build(configuration));

        LOG.info("Opened store {} at schema version {}.", this.where, schemaVersion);
    }

    /**
     * @param ifExists Fail rather than create the database when it is missing.
     */
    private String url(final boolean ifExists) {
        return "jdbc:h2:" + where.getAbsolutePath()
                + ";IFEXISTS=" + (ifExists ? "TRUE" : "FALSE")
                + ";NON_KEYWORDS=KEY,VALUE";
    }

    public int getSchemaVersion() {
        return schemaVersion;
    }

    public ThingMyBatis getThings() {
        return new ThingMyBatis(sqlSessionManager);
    }

    public KeyValueMyBatis getKeyValues() {
        return new KeyValueMyBatis(sqlSessionManager);
    }

    public InitiativeStore getStore() {
        return new InitiativeStore(getThings(), getKeyValues());
    }

    @Override
    public void close() {
        if (sqlSessionManager.isManagedSessionStarted()) {
            sqlSessionManager.close();
        }
        dataSource.forceCloseAll();
        LOG.debug("Closed store {}.", where);
    }
}
