package com.shardstore.migration.store;

import com.shardstore.migration.model.ShardType;
import com.shardstore.migration.schema.SchemaDefinition;

/**
 * Access to ShardTypes. All writes are conditional on the stored row version.
 */
public interface ShardTypeStore {

    /**
     * @throws com.shardstore.migration.exception.NotFoundException when absent
     */
    ShardType findById(String tenantId, String shardTypeId);

    /**
     * Store {@code newSchema} as current and increment the schema version,
     * provided the type is still at {@code expectedSchemaVersion}.
     */
    ShardType bumpSchemaVersion(
            String tenantId, String shardTypeId, int expectedSchemaVersion, SchemaDefinition newSchema);

    /**
     * Claim the single running-migration slot of the type for {@code migrationId}.
     * Re-claiming by the current holder succeeds.
     *
     * @throws com.shardstore.migration.exception.ConflictException when another migration holds it
     */
    ShardType acquireRunningSlot(String tenantId, String shardTypeId, String migrationId);

    /**
     * Free the running slot if {@code migrationId} holds it; no-op otherwise.
     */
    void releaseRunningSlot(String tenantId, String shardTypeId, String migrationId);
}
