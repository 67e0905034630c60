package com.github.basking2.initiative;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A record in the {@code things} table.
 *
 * The identifying fields are typed. Everything else a thing carries (age, gender, species, subtype and whatever
 * a later client adds) lives in an ordered map of free-form fields that is written flat next to the typed ones.
 * Values in that map are whatever JSON decoding produces: strings, numbers, booleans, lists and maps.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"uuid", "name", "type"})
public class Thing {
    public static final String TABLE = "things";

    public static final String NPC = "Npc";
    public static final String PLACE = "Place";

    private String uuid;
    private String name;
    private String type;
    private final Map<String, Object> fields = new LinkedHashMap<>();

    public Thing() {
    }

    public Thing(final String uuid, final String name, final String type) {
        this.uuid = uuid;
        this.name = name;
        this.type = type;
    }

    public String getUuid() {
        return uuid;
    }

    public void setUuid(final String uuid) {
        this.uuid = uuid;
    }

    public String getName() {
        return name;
    }

    public void setName(final String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    public void setType(final String type) {
        this.type = type;
    }

    /**
     * @return The free-form fields, in the order they were first set.
     */
    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return fields;
    }

    @JsonAnySetter
    public void setField(final String field, final Object value) {
        fields.put(field, value);
    }

    /**
     * Chaining form of {@link #setField(String, Object)}.
     *
     * @param field The field name.
     * @param value The value.
     * @return this.
     */
    public Thing with(final String field, final Object value) {
        setField(field, value);
        return this;
    }

    public Object getField(final String field) {
        return fields.get(field);
    }

    public boolean hasField(final String field) {
        return fields.get(field) != null;
    }

    public Object removeField(final String field) {
        return fields.remove(field);
    }

    /**
     * Copy this thing. Free-form values are shared, not cloned, so callers replace them rather than mutate them.
     *
     * @return A new thing with the same fields in the same order.
     */
    public Thing copy() {
        final Thing copy = new Thing(uuid, name, type);
        copy.fields.putAll(fields);
        return copy;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Thing)) {
            return false;
        }
        final Thing thing = (Thing) o;
        return Objects.equals(uuid, thing.uuid)
                && Objects.equals(name, thing.name)
                && Objects.equals(type, thing.type)
                && fields.equals(thing.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uuid, name, type, fields);
    }

    @Override
    public String toString() {
        return "Thing{uuid=" + uuid + ", name=" + name + ", type=" + type + ", fields=" + fields + "}";
    }
}
