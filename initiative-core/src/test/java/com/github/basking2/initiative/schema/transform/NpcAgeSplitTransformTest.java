package com.github.basking2.initiative.schema.transform;

import com.github.basking2.initiative.Thing;
import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class NpcAgeSplitTransformTest {
    private final NpcAgeSplitTransform transform = new NpcAgeSplitTransform();

    private static Map<String, Object> age(final String type, final Object value) {
        final Map<String, Object> age = new HashMap<>();
        if (type != null) {
            age.put("type", type);
        }
        if (value != null) {
            age.put("value", value);
        }
        return age;
    }

    @Test
    public void testSplitsAgeObject() {
        final Thing thing = new Thing("n", "Nell", Thing.NPC).with("age", age("Adult", 34));

        final Thing out = transform.apply(thing);

        assertEquals("Adult", out.getField("age"));
        assertEquals(34, out.getField("age_years"));
        assertTrue(thing.getField("age") instanceof Map);
        assertFalse(thing.hasField("age_years"));
    }

    @Test
    public void testAgeWithoutYears() {
        final Thing out = transform.apply(new Thing("n", "Nell", Thing.NPC).with("age", age("Elderly", null)));

        assertEquals("Elderly", out.getField("age"));
        assertFalse(out.getFields().containsKey("age_years"));
    }

    @Test
    public void testYearsWithoutCategory() {
        final Map<String, Object> legacy = age(null, 12);
        final Thing out = transform.apply(new Thing("n", "Nell", Thing.NPC).with("age", legacy));

        assertEquals(12, out.getField("age_years"));
        assertEquals(legacy, out.getField("age"));
    }

    @Test
    public void testEmptyHalvesAreNotCopied() {
        final Map<String, Object> legacy = new HashMap<>();
        legacy.put("type", "");
        legacy.put("value", 0);

        final Thing out = transform.apply(new Thing("n", "Nell", Thing.NPC).with("age", legacy));

        assertEquals(legacy, out.getField("age"));
        assertFalse(out.getFields().containsKey("age_years"));
    }

    @Test
    public void testZeroYearsKeepsCategory() {
        final Thing out = transform.apply(new Thing("n", "Nell", Thing.NPC).with("age", age("Child", 0)));

        assertEquals("Child", out.getField("age"));
        assertFalse(out.getFields().containsKey("age_years"));
    }

    @Test
    public void testOnlyNpcs() {
        final Thing place = new Thing("p", "Inn", "Location").with("age", age("Adult", 34));

        assertEquals(place, transform.apply(place));
    }

    @Test
    public void testPlainAgeUnchanged() {
        final Thing npc = new Thing("n", "Nell", Thing.NPC).with("age", "Adult");

        assertEquals(npc, transform.apply(npc));
    }

    @Test
    public void testIdempotent() {
        final Thing once = transform.apply(new Thing("n", "Nell", Thing.NPC).with("age", age("Adult", 34)));

        assertEquals(once, transform.apply(once));
    }
}
