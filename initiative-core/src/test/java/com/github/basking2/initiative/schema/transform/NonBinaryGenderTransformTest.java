package com.github.basking2.initiative.schema.transform;

import com.github.basking2.initiative.Thing;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class NonBinaryGenderTransformTest {
    private final NonBinaryGenderTransform transform = new NonBinaryGenderTransform();

    @Test
    public void testRenamesLegacyGender() {
        final Thing thing = new Thing("a", "Ash", Thing.NPC).with("gender", "Trans");

        final Thing out = transform.apply(thing);

        assertEquals("NonBinaryThey", out.getField("gender"));
        assertEquals("Trans", thing.getField("gender"));
    }

    @Test
    public void testOtherGendersUnchanged() {
        final Thing thing = new Thing("a", "Ash", Thing.NPC).with("gender", "Female").with("age", "Adult");

        assertEquals(thing, transform.apply(thing));
    }

    @Test
    public void testOnlyNpcs() {
        final Thing shrine = new Thing("p", "Shrine", Thing.PLACE).with("gender", "Trans");

        final Thing out = transform.apply(shrine);

        assertEquals("Trans", out.getField("gender"));
        assertEquals(shrine, out);
    }

    @Test
    public void testMissingGenderStaysMissing() {
        final Thing out = transform.apply(new Thing("a", "Ash", Thing.NPC));

        assertFalse(out.getFields().containsKey("gender"));
    }

    @Test
    public void testIdempotent() {
        final Thing once = transform.apply(new Thing("a", "Ash", Thing.NPC).with("gender", "Trans"));

        assertEquals(once, transform.apply(once));
    }
}
