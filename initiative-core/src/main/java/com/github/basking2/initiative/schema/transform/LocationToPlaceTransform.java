package com.github.basking2.initiative.schema.transform;

import com.github.basking2.initiative.Thing;
import com.github.basking2.initiative.schema.ThingTransform;

import java.util.Map;

/**
 * Schema version 6: things of type {@code Location} became {@code Place}.
 *
 * Locations kept their subtype one level down, as {@code {"subtype": {"subtype": "Tavern"}}}. For those the
 * nested value replaces the object.
 */
public class LocationToPlaceTransform implements ThingTransform {
    static final String LOCATION = "Location";
    static final String SUBTYPE = "subtype";

    @Override
    public Thing apply(final Thing thing) {
        final Thing out = thing.copy();

        if (!LOCATION.equals(out.getType())) {
            return out;
        }

        out.setType(Thing.PLACE);

        final Object subtype = out.getField(SUBTYPE);
        if (subtype instanceof Map) {
            final Object nested = ((Map<?, ?>) subtype).get(SUBTYPE);
            if (nested != null && !"".equals(nested)) {
                out.setField(SUBTYPE, nested);
            }
        }

        return out;
    }
}
