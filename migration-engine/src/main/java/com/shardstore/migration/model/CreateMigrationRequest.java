package com.shardstore.migration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.shardstore.migration.orchestration.MigrationOptions;
import com.shardstore.migration.schema.SchemaDefinition;
import com.shardstore.migration.transform.BuiltInTransformation;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.Set;

/**
 * Request DTO for creating a schema migration.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class CreateMigrationRequest {
    
    @NotBlank(message = "ShardType ID is required")
    private String shardTypeId;
    
    @NotNull(message = "New schema is required")
    private SchemaDefinition newSchema;
    
    /**
     * Optional; defaults to the strategy recommended by the diff.
     */
    private MigrationStrategy strategy;
    
    /**
     * Old field name to new field name, confirming renames.
     */
    private Map<String, String> fieldMappings;
    
    /**
     * Fill values for new required fields.
     */
    private Map<String, Object> defaultValues;
    
    /**
     * Value conversions for fields whose type changes.
     */
    private Map<String, BuiltInTransformation> typeTransformations;
    
    /**
     * Removed fields whose data may be dropped.
     */
    private Set<String> acknowledgedRemovals;
    
    public MigrationOptions toOptions() {
        return MigrationOptions.builder()
                .strategy(strategy)
                .fieldMappings(fieldMappings == null ? Map.of() : fieldMappings)
                .defaultValues(defaultValues == null ? Map.of() : defaultValues)
                .typeTransformations(typeTransformations == null ? Map.of() : typeTransformations)
                .acknowledgedRemovals(acknowledgedRemovals == null ? Set.of() : acknowledgedRemovals)
                .build();
    }
}
