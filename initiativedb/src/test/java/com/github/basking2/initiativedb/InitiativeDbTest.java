package com.github.basking2.initiativedb;

import com.github.basking2.initiative.StoreOpenException;
import com.github.basking2.initiative.Thing;
import com.github.basking2.initiative.db.InitiativeDbManager;
import com.github.basking2.initiative.schema.InitiativeSchema;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class InitiativeDbTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testEmbeddedConfiguration() throws Exception {
        final InitiativeDb app = new InitiativeDb();

        assertEquals(System.getProperty("user.home") + "/.initiativedb", app.getHome());
        assertEquals(InitiativeDbManager.DBADMIN_USER, app.getConfiguration().getString("initiativedb.db.user"));
    }

    @Test
    public void testSystemPropertyOverrides() throws Exception {
        final String home = folder.getRoot().getAbsolutePath();

        System.setProperty("initiativedb.home", home);
        try {
            assertEquals(home, new InitiativeDb().getHome());
        }
        finally {
            System.clearProperty("initiativedb.home");
        }
    }

    @Test
    public void testOpen() throws Exception {
        final BaseConfiguration configuration = new BaseConfiguration();
        configuration.setProperty("initiativedb.home", folder.getRoot().getAbsolutePath());

        final InitiativeDb app = new InitiativeDb(configuration);

        try (final InitiativeDbManager db = app.open()) {
            assertEquals(InitiativeSchema.CURRENT_VERSION, db.getSchemaVersion());
            assertTrue(db.getStore().saveThing(new Thing("u1", "Nell", Thing.NPC)));
        }

        assertTrue(new File(folder.getRoot(), "db.mv.db").exists());
    }

    @Test(expected = StoreOpenException.class)
    public void testOpenWithoutHome() throws Exception {
        new InitiativeDb(new BaseConfiguration()).open();
    }
}
