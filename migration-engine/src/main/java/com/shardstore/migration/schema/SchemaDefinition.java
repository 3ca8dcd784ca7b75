package com.shardstore.migration.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Ordered mapping from field name to {@link FieldDefinition}.
 * Immutable; equality ignores field order.
 */
@EqualsAndHashCode
public final class SchemaDefinition {

    private final Map<String, FieldDefinition> fields;

    private SchemaDefinition(Map<String, FieldDefinition> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static SchemaDefinition of(Map<String, FieldDefinition> fields) {
        return new SchemaDefinition(fields == null ? Map.of() : fields);
    }

    public static SchemaDefinition empty() {
        return new SchemaDefinition(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonValue
    public Map<String, FieldDefinition> getFields() {
        return fields;
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public FieldDefinition field(String name) {
        return fields.get(name);
    }

    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    @Override
    public String toString() {
        return "SchemaDefinition" + fields;
    }

    public static final class Builder {

        private final Map<String, FieldDefinition> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder field(String name, FieldDefinition definition) {
            fields.put(name, definition);
            return this;
        }

        public Builder field(String name, FieldType type, boolean required) {
            return field(name, FieldDefinition.builder().type(type).required(required).build());
        }

        public SchemaDefinition build() {
            return new SchemaDefinition(fields);
        }
    }
}
