package com.github.basking2.initiative;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Test;

import java.io.IOException;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.util.Arrays;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class ThingTest {
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    public void testUnknownFieldsSurviveJson() throws IOException {
        final String json = "{\"uuid\":\"u1\",\"name\":\"Nell\",\"type\":\"Npc\",\"age\":\"adult\",\"notes\":{\"debt\":3},\"tags\":[\"a\",\"b\"]}";

        final Thing thing = mapper.readValue(json, Thing.class);

        assertEquals("u1", thing.getUuid());
        assertEquals("Nell", thing.getName());
        assertEquals(Thing.NPC, thing.getType());
        assertEquals("adult", thing.getField("age"));
        assertEquals(3, ((Map<?, ?>) thing.getField("notes")).get("debt"));
        assertEquals(Arrays.asList("a", "b"), thing.getField("tags"));
        assertEquals(json, mapper.writeValueAsString(thing));
    }

    @Test
    public void testNullsOmitted() throws IOException {
        assertEquals("{\"uuid\":\"u1\"}", mapper.writeValueAsString(new Thing("u1", null, null)));
    }

    @Test
    public void testCopyIsIndependent() {
        final Thing thing = new Thing("u1", "Nell", Thing.NPC).with("age", "adult");
        final Thing copy = thing.copy();

        copy.setField("age", "elderly");
        copy.setName("Old Nell");

        assertEquals("adult", thing.getField("age"));
        assertEquals("Nell", thing.getName());
    }

    @Test
    public void testHasField() {
        final Thing thing = new Thing("u1", "Nell", Thing.NPC).with("age", null);

        assertFalse(thing.hasField("age"));
        assertNull(thing.getField("gender"));
        assertTrue(thing.with("gender", "male").hasField("gender"));
    }

    @Test
    public void testFailureClassification() {
        final Exception violation = new RuntimeException(new SQLIntegrityConstraintViolationException("dup"));

        assertEquals(StoreResult.Status.CONSTRAINT_VIOLATION, StoreResult.failure(violation).getStatus());
        assertEquals(StoreResult.Status.STORAGE_FAULT, StoreResult.failure(new SQLException("disk")).getStatus());
        assertEquals("x", StoreResult.<String>notFound().orElse("x"));
        assertEquals("y", StoreResult.ok("y").orElse("x"));
    }
}
