package com.shardstore.migration.store;

import java.util.Optional;

/**
 * Paginated access to the records of a ShardType and version-guarded writes.
 */
public interface RecordRepository {

    /**
     * Page of records of the type whose schema version is strictly below {@code belowVersion}.
     *
     * @param cursor continuation token from a previous page, or null for the first page
     */
    ShardPage listByTypeAndVersion(
            String tenantId, String shardTypeId, int belowVersion, int pageSize, String cursor);

    Optional<ShardRecord> findById(String tenantId, String id);

    /**
     * Write the record's payload and schema version only if the stored record is
     * still at {@code expectedVersion} and at the revision the record was read with.
     */
    WriteResult conditionalWrite(ShardRecord record, int expectedVersion);

    long countBelowVersion(String tenantId, String shardTypeId, int belowVersion);
}
