package com.shardstore.migration.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Declared type of a ShardType field.
 * Only the types needed to reason about compatibility are modelled.
 */
public enum FieldType {
    STRING("string"),
    TEXT("text"),
    INTEGER("integer"),
    FLOAT("float"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    DATE("date"),
    ENUM("enum"),
    SELECT("select"),
    MULTISELECT("multiselect"),
    JSON("json");

    private static final Map<FieldType, Set<FieldType>> WIDENINGS = Map.of(
        INTEGER, EnumSet.of(FLOAT, NUMBER),
        FLOAT, EnumSet.of(NUMBER),
        ENUM, EnumSet.of(STRING)
    );

    private final String value;

    FieldType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Whether every value valid for this type is also valid for {@code target}.
     */
    public boolean widensTo(FieldType target) {
        return WIDENINGS.getOrDefault(this, Set.of()).contains(target);
    }

    /**
     * Whether fields of this type carry a closed list of allowed values.
     */
    public boolean hasAllowedValues() {
        return this == ENUM || this == SELECT || this == MULTISELECT;
    }

    @JsonCreator
    public static FieldType fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown field type: " + value));
    }
}
