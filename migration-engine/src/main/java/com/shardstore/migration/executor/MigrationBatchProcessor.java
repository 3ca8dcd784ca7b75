package com.shardstore.migration.executor;

import com.shardstore.migration.config.MigrationProperties;
import com.shardstore.migration.exception.ConflictException;
import com.shardstore.migration.exception.NotFoundException;
import com.shardstore.migration.exception.TransformException;
import com.shardstore.migration.exception.ValidationException;
import com.shardstore.migration.infrastructure.persistence.ContinuationTokens;
import com.shardstore.migration.model.ExecutionProgress;
import com.shardstore.migration.model.MigrationStatus;
import com.shardstore.migration.model.MigrationStrategy;
import com.shardstore.migration.model.SchemaMigration;
import com.shardstore.migration.orchestration.MigrationPathResolver;
import com.shardstore.migration.store.MigrationRecordStore;
import com.shardstore.migration.store.RecordRepository;
import com.shardstore.migration.store.ShardPage;
import com.shardstore.migration.store.ShardRecord;
import com.shardstore.migration.store.ShardTypeStore;
import com.shardstore.migration.store.WriteResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Processes one page of a migration inside a single transaction.
 * Any repository failure rolls the whole page back, so the same continuation
 * token can be retried safely.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MigrationBatchProcessor {
    
    private final MigrationRecordStore migrationStore;
    private final ShardTypeStore shardTypeStore;
    private final RecordRepository recordRepository;
    private final MigrationPathResolver pathResolver;
    private final ShardUpgrader shardUpgrader;
    private final MigrationProperties properties;
    
    @Transactional
    public ExecutionProgress processNextPage(String migrationId, String tenantId, String continuationToken) {
        SchemaMigration migration = migrationStore.getById(migrationId, tenantId);
        
        if (migration.getStrategy() == MigrationStrategy.LAZY) {
            throw new ConflictException("Migration " + migrationId + " is lazy; records are upgraded on read");
        }
        if (!migration.getStatus().isActive()) {
            throw new ConflictException(String.format(
                    "Migration %s is not runnable in status: %s", migrationId, migration.getStatus()));
        }
        
        if (migration.getStatus() == MigrationStatus.PENDING) {
            migration = start(migration);
        } else {
            shardTypeStore.acquireRunningSlot(tenantId, migration.getShardTypeId(), migrationId);
        }
        
        String cursor = continuationToken != null ? continuationToken : migration.getCursor();
        int pageSize = properties.getBatch().getPageSize();
        
        int processed = 0;
        List<String> failedIds = new ArrayList<>();
        Set<String> retryIds = new LinkedHashSet<>(
                migration.getRetryShardIds() == null ? List.of() : migration.getRetryShardIds());
        Map<Integer, List<SchemaMigration>> paths = new HashMap<>();
        String nextCursor;
        
        if (ContinuationTokens.isRetryPass(cursor)) {
            List<String> batch = retryIds.stream().limit(pageSize).collect(Collectors.toList());
            batch.forEach(retryIds::remove);
            for (String recordId : batch) {
                if (retryRecord(migration, recordId, paths)) {
                    processed++;
                } else {
                    failedIds.add(recordId);
                }
            }
            nextCursor = retryIds.isEmpty() ? null : cursor;
        } else {
            ShardPage page = recordRepository.listByTypeAndVersion(
                    tenantId, migration.getShardTypeId(), migration.getToVersion(), pageSize, cursor);
            for (ShardRecord record : page.getRecords()) {
                RecordOutcome outcome = migrateRecord(migration, record, paths);
                if (outcome == RecordOutcome.MIGRATED) {
                    processed++;
                } else if (outcome == RecordOutcome.CONFLICT) {
                    retryIds.add(record.getId());
                } else {
                    failedIds.add(record.getId());
                }
            }
            nextCursor = page.getNextCursor();
            if (nextCursor == null && !retryIds.isEmpty()) {
                nextCursor = ContinuationTokens.retryPass();
            }
        }
        
        final int batchProcessed = processed;
        final String cursorAfter = nextCursor;
        final List<String> pendingRetries = new ArrayList<>(retryIds);
        MigrationStatus nextStatus = MigrationStatus.RUNNING;
        if (nextCursor == null) {
            nextStatus = migration.getFailedCount() + failedIds.size() > 0
                    ? MigrationStatus.COMPLETED_WITH_ERRORS
                    : MigrationStatus.COMPLETED;
        }
        
        SchemaMigration updated = migrationStore.updateStatus(
                migrationId, tenantId, MigrationStatus.RUNNING, nextStatus, m -> {
                    m.recordProgress(batchProcessed, failedIds, properties.getBatch().getFailureSampleSize());
                    m.setCursor(cursorAfter);
                    m.setRetryShardIds(pendingRetries);
                });
        
        log.info("[Migration-{}] Page processed: {} migrated, {} failed, {} awaiting retry (total {}/{}, more: {})",
                migrationId, batchProcessed, failedIds.size(), pendingRetries.size(),
                updated.getProcessedCount() + updated.getFailedCount(), updated.getTotalShards(), cursorAfter != null);
        
        if (nextStatus.isTerminal()) {
            shardTypeStore.releaseRunningSlot(tenantId, migration.getShardTypeId(), migrationId);
            log.info("[Migration-{}] ========== MIGRATION {} ==========", migrationId, nextStatus);
        }
        
        return ExecutionProgress.builder()
                .migrationId(migrationId)
                .status(updated.getStatus())
                .processedCount(updated.getProcessedCount())
                .failedCount(updated.getFailedCount())
                .totalShards(updated.getTotalShards())
                .batchProcessed(batchProcessed)
                .batchFailed(failedIds.size())
                .failedShardIds(List.copyOf(updated.getFailedShardIds()))
                .nextContinuationToken(cursorAfter)
                .build();
    }
    
    /**
     * First run: claim the type's running slot and move PENDING to RUNNING.
     */
    private SchemaMigration start(SchemaMigration migration) {
        String tenantId = migration.getTenantId();
        String shardTypeId = migration.getShardTypeId();
        
        boolean otherRunning = migrationStore.listByTypeAndStatus(tenantId, shardTypeId, MigrationStatus.RUNNING)
                .stream()
                .anyMatch(other -> !other.getId().equals(migration.getId()));
        if (otherRunning) {
            throw new ConflictException("Another migration is already running for ShardType " + shardTypeId);
        }
        shardTypeStore.acquireRunningSlot(tenantId, shardTypeId, migration.getId());
        
        long total = recordRepository.countBelowVersion(tenantId, shardTypeId, migration.getToVersion());
        log.info("[Migration-{}] ========== MIGRATION STARTED ({} record(s) to migrate) ==========",
                migration.getId(), total);
        
        return migrationStore.updateStatus(
                migration.getId(), tenantId, MigrationStatus.PENDING, MigrationStatus.RUNNING,
                m -> m.setTotalShards(total));
    }
    
    /**
     * Second and last attempt at a record whose write lost a race in the main pass.
     *
     * @return true when the record now carries the target version
     */
    private boolean retryRecord(
            SchemaMigration migration, String recordId, Map<Integer, List<SchemaMigration>> paths) {
        
        Optional<ShardRecord> current = recordRepository.findById(migration.getTenantId(), recordId);
        if (current.isEmpty() || !migration.getShardTypeId().equals(current.get().getShardTypeId())) {
            log.warn("[Migration-{}] Record {} disappeared before its retry", migration.getId(), recordId);
            return false;
        }
        if (current.get().getSchemaVersion() >= migration.getToVersion()) {
            return true;
        }
        return migrateRecord(migration, current.get(), paths) == RecordOutcome.MIGRATED;
    }
    
    /**
     * Transform and write back one record. Failures are isolated to the record.
     */
    private RecordOutcome migrateRecord(
            SchemaMigration migration, ShardRecord record, Map<Integer, List<SchemaMigration>> paths) {
        
        try {
            if (record.getStructuredData() == null) {
                throw new TransformException("Structured data is unreadable");
            }
            
            List<SchemaMigration> hops = hopsFor(migration, record.getSchemaVersion(), paths);
            Map<String, Object> migrated = shardUpgrader.applyPath(record.getStructuredData(), hops);
            
            ShardRecord rewritten = record.toBuilder()
                    .structuredData(migrated)
                    .schemaVersion(migration.getToVersion())
                    .build();
            
            if (recordRepository.conditionalWrite(rewritten, record.getSchemaVersion()) == WriteResult.CONFLICT) {
                log.warn("[Migration-{}] Record {} changed concurrently", migration.getId(), record.getId());
                return RecordOutcome.CONFLICT;
            }
            return RecordOutcome.MIGRATED;
            
        } catch (TransformException | NotFoundException e) {
            log.warn("[Migration-{}] Record {} not migrated: {}", migration.getId(), record.getId(), e.getMessage());
            return RecordOutcome.FAILED;
        }
    }
    
    private List<SchemaMigration> hopsFor(
            SchemaMigration migration, int recordVersion, Map<Integer, List<SchemaMigration>> paths) {
        
        if (recordVersion == migration.getFromVersion()) {
            return List.of(migration);
        }
        List<SchemaMigration> path = paths.get(recordVersion);
        if (path == null) {
            try {
                path = pathResolver.resolve(
                        migration.getTenantId(), migration.getShardTypeId(), recordVersion, migration.getToVersion());
            } catch (ValidationException e) {
                throw new TransformException("Record version " + recordVersion + " has no upgrade path: "
                        + e.getMessage(), e);
            }
            paths.put(recordVersion, path);
        }
        return path;
    }
    
    private enum RecordOutcome {
        MIGRATED,
        CONFLICT,
        FAILED
    }
}
