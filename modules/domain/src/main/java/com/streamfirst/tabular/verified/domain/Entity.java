package com.streamfirst.tabular.verified.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * A written or read-back row: a backend-assigned identity plus field values. Field values may be
 * null; fields the entity does not carry read as {@link Absent#VALUE}.
 */
@Value
@EqualsAndHashCode
public class Entity {

    /** Stable identity assigned by the backend */
    @NonNull Object id;

    /** Field name to value, in insertion order */
    @NonNull Map<String, Object> fields;

    private Entity(Object id, Map<String, Object> fields) {
        this.id = id;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Entity of(@NonNull Object id, @NonNull Map<String, ?> fields) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        return new Entity(id, copy);
    }

    /** Creates an entity that carries no fields, used for metadata rows identified by name. */
    public static Entity identity(@NonNull Object id) {
        return new Entity(id, Map.of());
    }

    /** Returns the field value, or {@link Absent#VALUE} when the field is not carried. */
    public Object get(String field) {
        return fields.containsKey(field) ? fields.get(field) : Absent.VALUE;
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    /** Returns a copy of this entity with its fields replaced by the given ones. */
    public Entity withFields(Map<String, ?> replacement) {
        return Entity.of(id, replacement);
    }

    @Override
    public String toString() {
        return "Entity{id=" + id + ", fields=" + fields + '}';
    }
}
