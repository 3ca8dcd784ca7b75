package com.shardstore.migration.util;

import com.shardstore.migration.exception.ValidationException;
import com.shardstore.migration.schema.FieldDefinition;
import com.shardstore.migration.schema.SchemaDefinition;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Utility class for schema and field name validation.
 */
@Slf4j
public class SchemaValidator {
    
    private static final int MAX_FIELD_NAME_LENGTH = 128;
    
    private SchemaValidator() {
        // Utility class - prevent instantiation
    }
    
    /**
     * Validates a field name.
     * Allows: letters, numbers, underscores and hyphens, not starting with a digit or hyphen.
     */
    public static boolean isValidFieldName(String fieldName) {
        if (fieldName == null || fieldName.isEmpty() || fieldName.length() > MAX_FIELD_NAME_LENGTH) {
            return false;
        }
        
        return fieldName.matches("^[a-zA-Z_][a-zA-Z0-9_-]*$");
    }
    
    /**
     * Collects every structural problem of a schema definition.
     */
    public static List<String> findProblems(SchemaDefinition schema) {
        List<String> problems = new ArrayList<>();
        if (schema == null) {
            problems.add("Schema is required");
            return problems;
        }
        
        for (Map.Entry<String, FieldDefinition> entry : schema.getFields().entrySet()) {
            String name = entry.getKey();
            FieldDefinition field = entry.getValue();
            
            if (!isValidFieldName(name)) {
                problems.add("Invalid field name: '" + name + "'");
            }
            if (field == null || field.getType() == null) {
                problems.add("Field '" + name + "' has no type");
                continue;
            }
            if (field.getAllowedValues() != null && !field.getType().hasAllowedValues()) {
                problems.add("Field '" + name + "' of type '" + field.getType().getValue()
                        + "' cannot declare allowed values");
            }
            if (field.getAllowedValues() != null && field.hasDefaultValue()
                    && !field.getAllowedValues().contains(String.valueOf(field.getDefaultValue()))) {
                problems.add("Default value of field '" + name + "' is not an allowed value");
            }
        }
        return problems;
    }
    
    /**
     * Throws exception if the schema is malformed.
     */
    public static void validateSchema(SchemaDefinition schema) {
        List<String> problems = findProblems(schema);
        if (!problems.isEmpty()) {
            log.warn("Rejected malformed schema: {}", problems);
            throw new ValidationException("Malformed schema", problems);
        }
    }
}
