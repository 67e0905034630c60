package com.github.basking2.initiative.schema.transform;

import com.github.basking2.initiative.Thing;
import com.github.basking2.initiative.schema.ThingTransform;

import java.util.Map;

/**
 * Schema version 4: an NPC's age used to be an object {@code {"type": "Adult", "value": 34}}.
 *
 * The age category stays in {@code age} and the number of years moves to a new {@code age_years} field.
 * Either half is only written when the legacy object carries a non-empty, non-zero value for it. Things that
 * are not NPCs, and NPCs whose age is not an object, are returned unchanged.
 */
public class NpcAgeSplitTransform implements ThingTransform {
    static final String AGE = "age";
    static final String AGE_YEARS = "age_years";

    @Override
    public Thing apply(final Thing thing) {
        final Thing out = thing.copy();

        if (!Thing.NPC.equals(out.getType())) {
            return out;
        }

        final Object age = out.getField(AGE);
        if (!(age instanceof Map)) {
            return out;
        }

        final Map<?, ?> legacy = (Map<?, ?>) age;
        final Object years = legacy.get("value");
        final Object category = legacy.get("type");

        if (isSet(years)) {
            out.setField(AGE_YEARS, years);
        }

        if (isSet(category)) {
            out.setField(AGE, category);
        }

        return out;
    }

    /**
     * Legacy clients wrote empty strings, zero and {@code false} for an unset half of the age.
     */
    private static boolean isSet(final Object value) {
        if (value == null || Boolean.FALSE.equals(value)) {
            return false;
        }
        if (value instanceof String) {
            return !((String) value).isEmpty();
        }
        if (value instanceof Number) {
            final double d = ((Number) value).doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        return true;
    }
}
