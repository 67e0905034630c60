package com.github.basking2.initiative.schema;

import com.github.basking2.initiative.Thing;
import com.github.basking2.initiative.schema.transform.LocationToPlaceTransform;
import com.github.basking2.initiative.schema.transform.LowercaseFieldsTransform;
import com.github.basking2.initiative.schema.transform.NonBinaryGenderTransform;
import com.github.basking2.initiative.schema.transform.NpcAgeSplitTransform;

import java.util.Arrays;
import java.util.Collections;

/**
 * The schema history of the initiative store. New versions are appended to {@link #registry()}; existing
 * entries are never edited, since stores in the wild were migrated through them.
 */
public final class InitiativeSchema {
    public static final String KEY_VALUE_TABLE = "key_value";

    public static final int CURRENT_VERSION = 7;

    static final TableDefinition THINGS_V1 = TableDefinition.table(Thing.TABLE)
            .primaryKey("uuid")
            .index("name", "type")
            .build();

    static final TableDefinition THINGS_V5 = TableDefinition.table(Thing.TABLE)
            .primaryKey("uuid")
            .unique("name")
            .index("type")
            .build();

    static final TableDefinition KEY_VALUE = TableDefinition.table(KEY_VALUE_TABLE)
            .primaryKey("key")
            .build();

    private InitiativeSchema() {
    }

    /**
     * @return A new registry holding every version up to {@link #CURRENT_VERSION}.
     */
    public static SchemaRegistry registry() {
        return new SchemaRegistry()
                .register(1, "things", Collections.singletonList(THINGS_V1), null)
                .register(2, "key value settings", Arrays.asList(THINGS_V1, KEY_VALUE), null)
                .register(3, "non-binary gender", Arrays.asList(THINGS_V1, KEY_VALUE), new NonBinaryGenderTransform())
                .register(4, "split npc age", Arrays.asList(THINGS_V1, KEY_VALUE), new NpcAgeSplitTransform())
                .register(5, "unique thing names", Arrays.asList(THINGS_V5, KEY_VALUE), null)
                .register(6, "location to place", Arrays.asList(THINGS_V5, KEY_VALUE), new LocationToPlaceTransform())
                .register(7, "lowercase enumerations", Arrays.asList(THINGS_V5, KEY_VALUE), new LowercaseFieldsTransform());
    }
}
