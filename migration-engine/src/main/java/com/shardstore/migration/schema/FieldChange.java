package com.shardstore.migration.schema;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A single field-level difference between two schemas.
 * {@code before} is null for added fields, {@code after} is null for removed fields.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FieldChange {

    String field;

    FieldDefinition before;

    FieldDefinition after;

    public static FieldChange added(String field, FieldDefinition after) {
        return FieldChange.builder().field(field).after(after).build();
    }

    public static FieldChange removed(String field, FieldDefinition before) {
        return FieldChange.builder().field(field).before(before).build();
    }

    public static FieldChange modified(String field, FieldDefinition before, FieldDefinition after) {
        return FieldChange.builder().field(field).before(before).after(after).build();
    }

    @JsonIgnore
    public boolean isTypeChanged() {
        return before != null && after != null && before.getType() != after.getType();
    }

    @JsonIgnore
    public boolean isMadeRequired() {
        return before != null && after != null && !before.isRequired() && after.isRequired();
    }

    @JsonIgnore
    public boolean isMadeOptional() {
        return before != null && after != null && before.isRequired() && !after.isRequired();
    }

    @JsonIgnore
    public boolean isDefaultChanged() {
        return before != null && after != null
                && !before.hasSameDefault(after);
    }

    /**
     * Allowed values present before the change and missing after it.
     * Empty unless both sides declare a closed value list.
     */
    @JsonIgnore
    public List<String> getRemovedAllowedValues() {
        if (before == null || after == null
                || before.getAllowedValues() == null || after.getAllowedValues() == null) {
            return List.of();
        }
        return before.getAllowedValues().stream()
                .filter(value -> !after.getAllowedValues().contains(value))
                .collect(Collectors.toList());
    }
}
