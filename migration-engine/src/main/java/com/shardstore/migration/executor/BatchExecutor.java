package com.shardstore.migration.executor;

import com.shardstore.migration.exception.ConflictException;
import com.shardstore.migration.exception.MigrationException;
import com.shardstore.migration.exception.NotFoundException;
import com.shardstore.migration.exception.RepositoryException;
import com.shardstore.migration.exception.ValidationException;
import com.shardstore.migration.model.ExecutionProgress;
import com.shardstore.migration.model.MigrationStatus;
import com.shardstore.migration.model.SchemaMigration;
import com.shardstore.migration.store.MigrationRecordStore;
import com.shardstore.migration.store.ShardTypeStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs eager migrations one page per call.
 * Expected failures propagate unchanged with the page rolled back; anything else
 * marks the migration FAILED before being rethrown.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BatchExecutor {
    
    private final MigrationBatchProcessor batchProcessor;
    private final MigrationRecordStore migrationStore;
    private final ShardTypeStore shardTypeStore;
    
    /**
     * Process the next page of a migration.
     *
     * @param continuationToken token returned by the previous run, or null to resume from the stored cursor
     */
    public ExecutionProgress run(String migrationId, String tenantId, String continuationToken) {
        log.info("[Migration-{}] Batch run requested (token: {})", migrationId, continuationToken);
        
        try {
            return batchProcessor.processNextPage(migrationId, tenantId, continuationToken);
            
        } catch (ConflictException | ValidationException | NotFoundException e) {
            log.warn("[Migration-{}] Batch run rejected: {}", migrationId, e.getMessage());
            throw e;
            
        } catch (RepositoryException e) {
            log.error("[Migration-{}] Storage failure, page rolled back: {}", migrationId, e.getMessage(), e);
            throw e;
            
        } catch (RuntimeException e) {
            log.error("[Migration-{}] ========== MIGRATION FAILED ==========", migrationId);
            log.error("[Migration-{}] Error: {}", migrationId, e.getMessage(), e);
            
            MigrationException failure = new MigrationException(
                    "Batch run of migration " + migrationId + " failed: " + e.getMessage(), e);
            try {
                markFailed(migrationId, tenantId, e);
            } catch (RuntimeException markEx) {
                log.error("[Migration-{}] Could not mark migration failed: {}", migrationId, markEx.getMessage());
                failure.addSuppressed(markEx);
            }
            throw failure;
        }
    }
    
    private void markFailed(String migrationId, String tenantId, RuntimeException cause) {
        SchemaMigration migration = migrationStore.getById(migrationId, tenantId);
        if (migration.getStatus() != MigrationStatus.RUNNING) {
            return;
        }
        String error = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        migrationStore.updateStatus(migrationId, tenantId, MigrationStatus.RUNNING, MigrationStatus.FAILED,
                m -> m.setLastError(error));
        shardTypeStore.releaseRunningSlot(tenantId, migration.getShardTypeId(), migrationId);
    }
}
