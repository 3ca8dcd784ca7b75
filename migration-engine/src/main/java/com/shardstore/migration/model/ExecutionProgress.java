package com.shardstore.migration.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one batch run. A null {@code nextContinuationToken} means no further run is needed.
 */
@Value
@Builder
public class ExecutionProgress {

    String migrationId;

    MigrationStatus status;

    long processedCount;

    long failedCount;

    Long totalShards;

    /**
     * Records migrated by this run only.
     */
    int batchProcessed;

    /**
     * Records that failed in this run only.
     */
    int batchFailed;

    @Builder.Default
    List<String> failedShardIds = List.of();

    String nextContinuationToken;

    public boolean hasMore() {
        return nextContinuationToken != null;
    }
}
