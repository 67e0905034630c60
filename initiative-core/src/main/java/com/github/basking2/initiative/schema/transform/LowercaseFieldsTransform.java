package com.github.basking2.initiative.schema.transform;

import com.github.basking2.initiative.Thing;
import com.github.basking2.initiative.schema.ThingTransform;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Schema version 7: enumerated fields are stored in lower, hyphenated case.
 *
 * Known multi-word spellings map to their hyphenated form. Any other string value is lowercased. Absent
 * fields stay absent and values that are not strings are left alone.
 */
public class LowercaseFieldsTransform implements ThingTransform {

    private static final Map<String, Map<String, String>> SPELLINGS = new HashMap<>();

    static {
        final Map<String, String> age = new HashMap<>();
        age.put("YoungAdult", "young-adult");
        age.put("MiddleAged", "middle-aged");

        final Map<String, String> gender = new HashMap<>();
        gender.put("NonBinaryThey", "non-binary");

        final Map<String, String> species = new HashMap<>();
        species.put("HalfElf", "half-elf");
        species.put("HalfOrc", "half-orc");

        SPELLINGS.put("age", Collections.unmodifiableMap(age));
        SPELLINGS.put("ethnicity", Collections.emptyMap());
        SPELLINGS.put("gender", Collections.unmodifiableMap(gender));
        SPELLINGS.put("species", Collections.unmodifiableMap(species));
        SPELLINGS.put("subtype", Collections.emptyMap());
    }

    @Override
    public Thing apply(final Thing thing) {
        final Thing out = thing.copy();

        for (final Map.Entry<String, Map<String, String>> field : SPELLINGS.entrySet()) {
            final Object value = out.getField(field.getKey());

            if (value instanceof String && !((String) value).isEmpty()) {
                final String known = field.getValue().get(value);
                out.setField(field.getKey(), known != null ? known : ((String) value).toLowerCase(Locale.ROOT));
            }
        }

        return out;
    }
}
