package com.shardstore.migration.transform;

import com.shardstore.migration.schema.SchemaDiff;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Everything the {@link FieldTransformer} needs to move one record across one schema version.
 */
@Value
@Builder
public class TransformPlan {

    /**
     * Old field name to new field name.
     */
    @Builder.Default
    Map<String, String> fieldMappings = Map.of();

    /**
     * New field name to fill value for records that do not carry it.
     */
    @Builder.Default
    Map<String, Object> defaultValues = Map.of();

    /**
     * New field name to value conversion, applied after field mappings.
     */
    @Builder.Default
    Map<String, BuiltInTransformation> typeTransformations = Map.of();

    @Builder.Default
    SchemaDiff diff = SchemaDiff.empty();
}
