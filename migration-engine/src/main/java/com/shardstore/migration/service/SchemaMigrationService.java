package com.shardstore.migration.service;

import com.shardstore.migration.exception.ValidationException;
import com.shardstore.migration.executor.BatchExecutor;
import com.shardstore.migration.executor.ShardUpgrader;
import com.shardstore.migration.model.CreateMigrationRequest;
import com.shardstore.migration.model.ExecutionProgress;
import com.shardstore.migration.model.SchemaMigration;
import com.shardstore.migration.model.SchemaPreview;
import com.shardstore.migration.model.ShardType;
import com.shardstore.migration.model.ShardUpgrade;
import com.shardstore.migration.orchestration.MigrationOptions;
import com.shardstore.migration.orchestration.MigrationOrchestrator;
import com.shardstore.migration.schema.SchemaDefinition;
import com.shardstore.migration.store.MigrationRecordStore;
import com.shardstore.migration.store.ShardTypeStore;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Caller-facing entry point of the schema migration engine.
 * Every operation is scoped to a tenant; records of other tenants are reported as not found.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SchemaMigrationService {

    private final MigrationOrchestrator orchestrator;
    private final BatchExecutor batchExecutor;
    private final ShardUpgrader shardUpgrader;
    private final MigrationRecordStore migrationStore;
    private final ShardTypeStore shardTypeStore;
    private final Validator validator;

    public SchemaPreview previewDiff(String tenantId, String shardTypeId, SchemaDefinition newSchema) {
        return previewDiff(tenantId, shardTypeId, newSchema, MigrationOptions.none());
    }

    /**
     * Diff the ShardType's current schema against {@code newSchema} and report which
     * breaking changes {@code options} would leave unresolved. Nothing is persisted.
     */
    public SchemaPreview previewDiff(
            String tenantId, String shardTypeId, SchemaDefinition newSchema, MigrationOptions options) {
        if (newSchema == null) {
            throw new ValidationException("New schema is required");
        }
        ShardType shardType = shardTypeStore.findById(tenantId, shardTypeId);
        return orchestrator.preview(shardType, newSchema, options);
    }

    public SchemaMigration createMigration(String tenantId, String actorId, CreateMigrationRequest request) {
        validate(request);
        log.info("Creating schema migration for ShardType {} (tenant {}, actor {})",
                request.getShardTypeId(), tenantId, actorId);

        ShardType shardType = shardTypeStore.findById(tenantId, request.getShardTypeId());
        return orchestrator.createMigration(tenantId, shardType, request.getNewSchema(), actorId, request.toOptions());
    }

    /**
     * Process one page of an eager migration.
     *
     * @param continuationToken token from the previous run; null resumes from the stored cursor
     */
    public ExecutionProgress runMigration(String tenantId, String migrationId, String continuationToken) {
        return batchExecutor.run(migrationId, tenantId, continuationToken);
    }

    public SchemaMigration cancelMigration(String tenantId, String migrationId) {
        return orchestrator.cancelMigration(migrationId, tenantId);
    }

    public SchemaMigration getMigration(String tenantId, String migrationId) {
        return migrationStore.getById(migrationId, tenantId);
    }

    public List<SchemaMigration> listMigrationsForType(String tenantId, String shardTypeId) {
        return migrationStore.listByType(tenantId, shardTypeId);
    }

    public List<SchemaMigration> listMigrationsForTenant(String tenantId) {
        return migrationStore.listByTenant(tenantId);
    }

    public List<SchemaMigration> getMigrationPath(
            String tenantId, String shardTypeId, int fromVersion, int toVersion) {
        return orchestrator.getMigrationPath(tenantId, shardTypeId, fromVersion, toVersion);
    }

    /**
     * In-memory upgrade of a record read at an older schema version. The result is not written back.
     */
    public ShardUpgrade upgradeShard(
            String tenantId, String shardTypeId, Map<String, Object> structuredData, int schemaVersion) {
        return shardUpgrader.upgradeToCurrent(tenantId, shardTypeId, structuredData, schemaVersion);
    }

    private void validate(CreateMigrationRequest request) {
        if (request == null) {
            throw new ValidationException("Migration request is required");
        }
        Set<ConstraintViolation<CreateMigrationRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            List<String> reasons = violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .sorted()
                    .collect(Collectors.toList());
            throw new ValidationException("Invalid migration request", reasons);
        }
    }
}
