package com.github.basking2.initiative.schema.transform;

import com.github.basking2.initiative.Thing;
import org.junit.Test;

import java.util.Collections;
import java.util.Map;

import static org.junit.Assert.assertEquals;

public class LocationToPlaceTransformTest {
    private final LocationToPlaceTransform transform = new LocationToPlaceTransform();

    @Test
    public void testLocationBecomesPlaceWithFlatSubtype() {
        final Thing thing = new Thing("l", "The Prancing Pony", "Location")
                .with("subtype", Collections.singletonMap("subtype", "Tavern"));

        final Thing out = transform.apply(thing);

        assertEquals(Thing.PLACE, out.getType());
        assertEquals("Tavern", out.getField("subtype"));
        assertEquals("Location", thing.getType());
    }

    @Test
    public void testEmptyNestedSubtypeKept() {
        final Map<String, Object> empty = Collections.singletonMap("subtype", "");
        final Thing out = transform.apply(new Thing("l", "Nowhere", "Location").with("subtype", empty));

        assertEquals(Thing.PLACE, out.getType());
        assertEquals(empty, out.getField("subtype"));
    }

    @Test
    public void testLocationWithoutSubtype() {
        final Thing out = transform.apply(new Thing("l", "Nowhere", "Location"));

        assertEquals(Thing.PLACE, out.getType());
        assertEquals(null, out.getField("subtype"));
    }

    @Test
    public void testOtherTypesUnchanged() {
        final Thing npc = new Thing("n", "Nell", Thing.NPC)
                .with("subtype", Collections.singletonMap("subtype", "Tavern"));

        assertEquals(npc, transform.apply(npc));
    }

    @Test
    public void testIdempotent() {
        final Thing once = transform.apply(new Thing("l", "The Prancing Pony", "Location")
                .with("subtype", Collections.singletonMap("subtype", "Tavern")));

        assertEquals(once, transform.apply(once));
    }
}
