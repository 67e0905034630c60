package com.github.basking2.initiativedb;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.io.FileUtils;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class InitiativeDbMainTest {
    private final ObjectMapper mapper = new ObjectMapper();

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private InitiativeDb app;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @Before
    public void setup() throws Exception {
        final BaseConfiguration configuration = new BaseConfiguration();
        configuration.setProperty("initiativedb.home", folder.newFolder("home").getAbsolutePath());
        app = new InitiativeDb(configuration);
    }

    private int run(final String... args) throws Exception {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();

        try (
                final PrintStream outStream = new PrintStream(out, true, "UTF-8");
                final PrintStream errStream = new PrintStream(err, true, "UTF-8")
        ) {
            return InitiativeDbMain.run(app, args, outStream, errStream);
        }
    }

    private JsonNode output() throws Exception {
        return mapper.readTree(out.toString("UTF-8"));
    }

    @Test
    public void testThings() throws Exception {
        assertEquals(InitiativeDbMain.OK, run("put", "{\"uuid\":\"u1\",\"name\":\"Nell\",\"type\":\"Npc\",\"age\":\"adult\"}"));
        assertEquals(InitiativeDbMain.FAILED, run("put", "{\"uuid\":\"u2\",\"name\":\"Nell\",\"type\":\"Npc\"}"));

        assertEquals(InitiativeDbMain.OK, run("get", "u1"));
        assertEquals("adult", output().get("age").asText());

        assertEquals(InitiativeDbMain.OK, run("find", "Nell"));
        assertEquals("u1", output().get("uuid").asText());

        assertEquals(InitiativeDbMain.OK, run("list"));
        assertEquals(1, output().size());

        assertEquals(InitiativeDbMain.OK, run("delete", "u1"));
        assertEquals(InitiativeDbMain.OK, run("delete", "u1"));
        assertEquals(InitiativeDbMain.FAILED, run("get", "u1"));
    }

    @Test
    public void testValues() throws Exception {
        assertEquals(InitiativeDbMain.OK, run("set-value", "order", "[\"u2\",\"u1\"]"));

        assertEquals(InitiativeDbMain.OK, run("get-value", "order"));
        assertEquals("u2", output().get(0).asText());

        assertEquals(InitiativeDbMain.OK, run("delete-value", "order"));
        assertEquals(InitiativeDbMain.FAILED, run("get-value", "order"));
    }

    @Test
    public void testExportAndImport() throws Exception {
        assertEquals(InitiativeDbMain.OK, run("put", "{\"uuid\":\"u1\",\"name\":\"Nell\"}"));
        assertEquals(InitiativeDbMain.OK, run("set-value", "round", "3"));
        assertEquals(InitiativeDbMain.OK, run("export"));

        final File export = folder.newFile("export.json");
        FileUtils.writeStringToFile(export, out.toString("UTF-8"), StandardCharsets.UTF_8);

        final String otherHome = folder.newFolder("other").getAbsolutePath();
        assertEquals(InitiativeDbMain.OK, run("--home", otherHome, "import", export.getAbsolutePath()));
        assertEquals("imported=2, rejected=0", out.toString("UTF-8").trim());

        assertEquals(InitiativeDbMain.OK, run("-H", otherHome, "get", "u1"));
        assertEquals("Nell", output().get("name").asText());
    }

    @Test
    public void testImportOfNonObjectFails() throws Exception {
        final File array = folder.newFile("array.json");
        FileUtils.writeStringToFile(array, "[]", StandardCharsets.UTF_8);

        assertEquals(InitiativeDbMain.FAILED, run("import", array.getAbsolutePath()));
        assertTrue(err.toString("UTF-8").contains("not an exported store document"));

        final File empty = folder.newFile("empty.json");
        assertEquals(InitiativeDbMain.FAILED, run("import", empty.getAbsolutePath()));
    }

    @Test
    public void testVersion() throws Exception {
        assertEquals(InitiativeDbMain.OK, run("version"));
        assertEquals("7", out.toString("UTF-8").trim());
    }

    @Test
    public void testUsage() throws Exception {
        assertEquals(InitiativeDbMain.USAGE, run());
        assertEquals(InitiativeDbMain.USAGE, run("-h"));
        assertTrue(err.toString("UTF-8").contains("initiativedb"));
        assertEquals(InitiativeDbMain.USAGE, run("--bogus"));
        assertEquals(InitiativeDbMain.USAGE, run("frobnicate"));
    }

    @Test
    public void testMissingArgument() throws Exception {
        assertEquals(InitiativeDbMain.FAILED, run("get"));
        assertTrue(err.toString("UTF-8").contains("get"));
    }
}
