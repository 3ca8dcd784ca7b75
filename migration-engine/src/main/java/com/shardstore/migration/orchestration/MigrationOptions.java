package com.shardstore.migration.orchestration;

import com.shardstore.migration.model.MigrationStrategy;
import com.shardstore.migration.transform.BuiltInTransformation;
import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * Caller choices accompanying a schema change.
 */
@Value
@Builder
public class MigrationOptions {

    /**
     * Null means "use the diff's recommended strategy".
     */
    MigrationStrategy strategy;

    @Builder.Default
    Map<String, String> fieldMappings = Map.of();

    @Builder.Default
    Map<String, Object> defaultValues = Map.of();

    @Builder.Default
    Map<String, BuiltInTransformation> typeTransformations = Map.of();

    /**
     * Removed fields (or narrowed value lists) the caller accepts losing data for.
     */
    @Builder.Default
    Set<String> acknowledgedRemovals = Set.of();

    public static MigrationOptions none() {
        return MigrationOptions.builder().build();
    }
}
