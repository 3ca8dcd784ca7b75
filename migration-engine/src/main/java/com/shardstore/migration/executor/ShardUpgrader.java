package com.shardstore.migration.executor;

import com.shardstore.migration.model.SchemaMigration;
import com.shardstore.migration.model.ShardType;
import com.shardstore.migration.model.ShardUpgrade;
import com.shardstore.migration.orchestration.MigrationPathResolver;
import com.shardstore.migration.store.ShardTypeStore;
import com.shardstore.migration.transform.FieldTransformer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Applies one or more consecutive migrations to a record payload.
 * Shared by batch execution and the on-read upgrade path.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ShardUpgrader {
    
    private final FieldTransformer fieldTransformer;
    private final MigrationPathResolver pathResolver;
    private final ShardTypeStore shardTypeStore;
    
    /**
     * Run the payload through every hop of {@code path} in order.
     *
     * @throws com.shardstore.migration.exception.TransformException if any hop fails
     */
    public Map<String, Object> applyPath(Map<String, Object> structuredData, List<SchemaMigration> path) {
        Map<String, Object> data = structuredData;
        for (SchemaMigration hop : path) {
            data = fieldTransformer.transform(data, hop.toTransformPlan());
        }
        return data;
    }
    
    /**
     * Bring a payload written under {@code schemaVersion} to the ShardType's current version
     * without writing it back.
     *
     * @throws com.shardstore.migration.exception.NotFoundException if the upgrade path is broken
     */
    public ShardUpgrade upgradeToCurrent(
            String tenantId, String shardTypeId, Map<String, Object> structuredData, int schemaVersion) {
        
        ShardType shardType = shardTypeStore.findById(tenantId, shardTypeId);
        int currentVersion = shardType.getSchemaVersion();
        
        if (schemaVersion >= currentVersion) {
            return ShardUpgrade.builder()
                    .structuredData(structuredData)
                    .schemaVersion(schemaVersion)
                    .build();
        }
        
        List<SchemaMigration> path = pathResolver.resolve(tenantId, shardTypeId, schemaVersion, currentVersion);
        Map<String, Object> upgraded = applyPath(structuredData, path);
        
        log.debug("Upgraded record of type {} in memory v{} -> v{}", shardTypeId, schemaVersion, currentVersion);
        return ShardUpgrade.builder()
                .structuredData(upgraded)
                .schemaVersion(currentVersion)
                .appliedMigrationIds(path.stream().map(SchemaMigration::getId).collect(Collectors.toList()))
                .build();
    }
}
