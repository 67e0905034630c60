package com.github.basking2.initiative.schema.transform;

import com.github.basking2.initiative.Thing;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class LowercaseFieldsTransformTest {
    private final LowercaseFieldsTransform transform = new LowercaseFieldsTransform();

    @Test
    public void testKnownSpellings() {
        final Thing out = transform.apply(new Thing("n", "Nell", Thing.NPC)
                .with("age", "YoungAdult")
                .with("gender", "NonBinaryThey")
                .with("species", "HalfElf"));

        assertEquals("young-adult", out.getField("age"));
        assertEquals("non-binary", out.getField("gender"));
        assertEquals("half-elf", out.getField("species"));
    }

    @Test
    public void testOtherValuesLowercased() {
        final Thing thing = new Thing("n", "Nell", Thing.NPC)
                .with("age", "Adult")
                .with("ethnicity", "Dwarvish")
                .with("subtype", "Tavern");

        final Thing out = transform.apply(thing);

        assertEquals("adult", out.getField("age"));
        assertEquals("dwarvish", out.getField("ethnicity"));
        assertEquals("tavern", out.getField("subtype"));
        assertEquals("Adult", thing.getField("age"));
    }

    @Test
    public void testUnlistedFieldsAndNamesUntouched() {
        final Thing out = transform.apply(new Thing("n", "Nell", "Npc").with("notes", "Owes Money"));

        assertEquals("Nell", out.getName());
        assertEquals("Npc", out.getType());
        assertEquals("Owes Money", out.getField("notes"));
    }

    @Test
    public void testAbsentAndNonStringValues() {
        final Thing out = transform.apply(new Thing("n", "Nell", Thing.NPC).with("age_years", 34).with("species", 7));

        assertFalse(out.getFields().containsKey("age"));
        assertFalse(out.getFields().containsKey("gender"));
        assertEquals(7, out.getField("species"));
    }

    @Test
    public void testIdempotent() {
        final Thing once = transform.apply(new Thing("n", "Nell", Thing.NPC)
                .with("age", "MiddleAged")
                .with("species", "HalfOrc")
                .with("gender", "Male"));

        assertEquals(once, transform.apply(once));
    }
}
