package com.github.basking2.initiative.schema.transform;

import com.github.basking2.initiative.Thing;
import com.github.basking2.initiative.schema.ThingTransform;

/**
 * Schema version 3: the NPC gender spelled {@code Trans} became {@code NonBinaryThey}. Other things are
 * returned unchanged.
 */
public class NonBinaryGenderTransform implements ThingTransform {
    static final String LEGACY = "Trans";
    static final String CURRENT = "NonBinaryThey";

    @Override
    public Thing apply(final Thing thing) {
        final Thing out = thing.copy();

        if (Thing.NPC.equals(out.getType()) && LEGACY.equals(out.getField("gender"))) {
            out.setField("gender", CURRENT);
        }

        return out;
    }
}
