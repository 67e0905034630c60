package com.github.basking2.initiative.schema;

import com.github.basking2.initiative.Thing;

/**
 * Rewrite one stored thing from the shape of the previous schema version to the shape of the version the
 * transform is registered at.
 *
 * Implementations must be total: any thing, legacy or current, goes in and a thing comes out. Only fields whose
 * legacy form is recognized are changed. Applying a transform to its own output changes nothing.
 */
@FunctionalInterface
public interface ThingTransform {
    /**
     * @param thing The stored thing. Implementations must not modify it.
     * @return The rewritten thing.
     */
    Thing apply(Thing thing);
}
