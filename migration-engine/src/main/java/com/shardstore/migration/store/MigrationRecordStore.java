package com.shardstore.migration.store;

import com.shardstore.migration.model.MigrationStatus;
import com.shardstore.migration.model.SchemaMigration;

import java.util.List;
import java.util.function.Consumer;

/**
 * Persistence of {@link SchemaMigration} rows.
 */
public interface MigrationRecordStore {

    SchemaMigration create(SchemaMigration migration);

    /**
     * @throws com.shardstore.migration.exception.NotFoundException when absent or owned by another tenant
     */
    SchemaMigration getById(String id, String tenantId);

    /**
     * Conditional transition. Applies {@code patch} and moves to {@code newStatus}
     * only if the stored status still equals {@code expectedStatus}.
     *
     * @throws com.shardstore.migration.exception.ConflictException when the status moved
     *         or another writer updated the row concurrently
     */
    SchemaMigration updateStatus(
            String id,
            String tenantId,
            MigrationStatus expectedStatus,
            MigrationStatus newStatus,
            Consumer<SchemaMigration> patch);

    List<SchemaMigration> listByType(String tenantId, String shardTypeId);

    List<SchemaMigration> listByTenant(String tenantId);

    List<SchemaMigration> listByTypeAndStatus(String tenantId, String shardTypeId, MigrationStatus status);

    /**
     * Migrations whose range lies within [fromVersion, toVersion], ordered by fromVersion.
     */
    List<SchemaMigration> listInVersionRange(String tenantId, String shardTypeId, int fromVersion, int toVersion);
}
