package com.shardstore.migration.orchestration;

import com.shardstore.migration.exception.ConflictException;
import com.shardstore.migration.exception.ValidationException;
import com.shardstore.migration.model.MigrationStatus;
import com.shardstore.migration.model.MigrationStrategy;
import com.shardstore.migration.model.SchemaMigration;
import com.shardstore.migration.model.SchemaPreview;
import com.shardstore.migration.model.ShardType;
import com.shardstore.migration.schema.BreakingChange;
import com.shardstore.migration.schema.CompatibilityClassifier;
import com.shardstore.migration.schema.CompatibilityResult;
import com.shardstore.migration.schema.FieldChange;
import com.shardstore.migration.schema.SchemaDefinition;
import com.shardstore.migration.schema.SchemaDiff;
import com.shardstore.migration.schema.SchemaDiffer;
import com.shardstore.migration.store.MigrationRecordStore;
import com.shardstore.migration.store.ShardTypeStore;
import com.shardstore.migration.util.SchemaValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Creates schema migrations, resolves upgrade paths and cancels migrations.
 * Batch execution lives in {@link com.shardstore.migration.executor.BatchExecutor}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MigrationOrchestrator {
    
    private final SchemaDiffer schemaDiffer;
    private final CompatibilityClassifier compatibilityClassifier;
    private final MigrationRecordStore migrationStore;
    private final ShardTypeStore shardTypeStore;
    private final MigrationPathResolver pathResolver;
    
    /**
     * Diff and classify a proposed schema without persisting anything.
     */
    public SchemaPreview preview(ShardType shardType, SchemaDefinition newSchema, MigrationOptions options) {
        SchemaValidator.validateSchema(newSchema);
        
        SchemaDiff diff = schemaDiffer.diff(shardType.getSchema(), newSchema);
        CompatibilityResult compatibility = compatibilityClassifier.classify(diff);
        MigrationOptions effective = options == null ? MigrationOptions.none() : options;
        
        return SchemaPreview.builder()
                .shardTypeId(shardType.getId())
                .currentVersion(shardType.getSchemaVersion())
                .diff(diff)
                .compatibility(compatibility)
                .summary(diff.summary())
                .recommendedStrategy(diff.recommendedStrategy())
                .unresolvedReasons(messages(unresolvedBreakingChanges(compatibility, effective)))
                .build();
    }
    
    /**
     * Bump the ShardType's schema and record a pending migration, atomically.
     *
     * @throws ValidationException if the schema or options are invalid or breaking changes remain unresolved
     * @throws ConflictException if the ShardType changed since it was read
     */
    @Transactional
    public SchemaMigration createMigration(
            String tenantId,
            ShardType shardType,
            SchemaDefinition newSchema,
            String actorId,
            MigrationOptions options) {
        
        MigrationOptions effective = options == null ? MigrationOptions.none() : options;
        SchemaValidator.validateSchema(newSchema);
        
        SchemaDefinition currentSchema = shardType.getSchema();
        SchemaDiff diff = schemaDiffer.diff(currentSchema, newSchema);
        if (diff.isEmpty()) {
            throw new ValidationException("No schema changes detected for ShardType " + shardType.getId());
        }
        
        validateOptions(currentSchema, newSchema, diff, effective);
        
        CompatibilityResult compatibility = compatibilityClassifier.classify(diff);
        List<BreakingChange> unresolved = unresolvedBreakingChanges(compatibility, effective);
        if (!unresolved.isEmpty()) {
            log.warn("Rejected schema change for ShardType {}: {} unresolved breaking change(s)",
                    shardType.getId(), unresolved.size());
            throw new ValidationException("Unresolved breaking changes", messages(unresolved));
        }
        
        MigrationStrategy strategy = effective.getStrategy() != null
                ? effective.getStrategy()
                : diff.recommendedStrategy();
        
        int fromVersion = shardType.getSchemaVersion();
        ShardType bumped = shardTypeStore.bumpSchemaVersion(tenantId, shardType.getId(), fromVersion, newSchema);
        
        SchemaMigration migration = migrationStore.create(SchemaMigration.builder()
                .id(UUID.randomUUID().toString())
                .tenantId(tenantId)
                .shardTypeId(shardType.getId())
                .fromVersion(fromVersion)
                .toVersion(bumped.getSchemaVersion())
                .strategy(strategy)
                .fromSchema(currentSchema)
                .toSchema(newSchema)
                .diff(diff)
                .fieldMappings(new LinkedHashMap<>(effective.getFieldMappings()))
                .defaultValues(new LinkedHashMap<>(effective.getDefaultValues()))
                .typeTransformations(new LinkedHashMap<>(effective.getTypeTransformations()))
                .status(MigrationStatus.PENDING)
                .createdBy(actorId)
                .build());
        
        log.info("[Migration-{}] Created for ShardType {} v{} -> v{} ({}, {})",
                migration.getId(), shardType.getId(), fromVersion, migration.getToVersion(),
                strategy, diff.summary());
        return migration;
    }
    
    public List<SchemaMigration> getMigrationPath(String tenantId, String shardTypeId, int fromVersion, int toVersion) {
        return pathResolver.resolve(tenantId, shardTypeId, fromVersion, toVersion);
    }
    
    /**
     * Cancel a pending or running migration. Records already migrated stay migrated.
     */
    @Transactional
    public SchemaMigration cancelMigration(String id, String tenantId) {
        SchemaMigration migration = migrationStore.getById(id, tenantId);
        MigrationStatus current = migration.getStatus();
        
        if (!current.isActive()) {
            throw new ConflictException("Cannot cancel migration in status: " + current);
        }
        
        SchemaMigration cancelled = migrationStore.updateStatus(id, tenantId, current, MigrationStatus.CANCELLED, null);
        shardTypeStore.releaseRunningSlot(tenantId, migration.getShardTypeId(), id);
        
        log.info("[Migration-{}] Cancelled after {} migrated / {} failed record(s)",
                id, cancelled.getProcessedCount(), cancelled.getFailedCount());
        return cancelled;
    }
    
    /**
     * Breaking changes not covered by the caller's mappings, defaults, transformations or acknowledgements.
     */
    List<BreakingChange> unresolvedBreakingChanges(CompatibilityResult compatibility, MigrationOptions options) {
        return compatibility.getBreakingChanges().stream()
                .filter(change -> !isResolved(change, options))
                .collect(Collectors.toList());
    }
    
    private boolean isResolved(BreakingChange change, MigrationOptions options) {
        String field = change.getField();
        switch (change.getKind()) {
            case REQUIRED_FIELD_ADDED:
                return options.getDefaultValues().get(field) != null
                        || options.getFieldMappings().containsValue(field);
            case MADE_REQUIRED:
                return options.getDefaultValues().get(field) != null;
            case FIELD_REMOVED:
            case POSSIBLE_RENAME:
                return options.getFieldMappings().containsKey(field)
                        || options.getAcknowledgedRemovals().contains(field);
            case TYPE_CHANGED:
                return options.getTypeTransformations().containsKey(field);
            case ALLOWED_VALUE_REMOVED:
                return options.getAcknowledgedRemovals().contains(field);
            default:
                return false;
        }
    }
    
    private void validateOptions(
            SchemaDefinition oldSchema, SchemaDefinition newSchema, SchemaDiff diff, MigrationOptions options) {
        
        List<String> problems = new ArrayList<>();
        Set<String> mappingTargets = new HashSet<>();
        
        for (Map.Entry<String, String> mapping : options.getFieldMappings().entrySet()) {
            String from = mapping.getKey();
            String to = mapping.getValue();
            if (diff.findRemoved(from).isEmpty()) {
                problems.add("Field mapping source '" + from + "' is not a field removed by this change");
            }
            if (to == null || diff.findAdded(to).isEmpty()) {
                problems.add("Field mapping target '" + to + "' is not a field added by this change");
            }
            if (to != null && !mappingTargets.add(to)) {
                problems.add("Field '" + to + "' is the target of more than one mapping");
            }
        }
        
        for (String field : options.getDefaultValues().keySet()) {
            if (!newSchema.hasField(field)) {
                problems.add("Default value given for unknown field '" + field + "'");
            }
        }
        
        for (String field : options.getTypeTransformations().keySet()) {
            boolean typeChanged = diff.findModified(field).map(FieldChange::isTypeChanged).orElse(false);
            if (!typeChanged && !mappingTargets.contains(field)) {
                problems.add("Type transformation given for field '" + field + "' whose type does not change");
            }
        }
        
        for (String field : options.getAcknowledgedRemovals()) {
            boolean narrowed = diff.findModified(field)
                    .map(change -> !change.getRemovedAllowedValues().isEmpty())
                    .orElse(false);
            if (!oldSchema.hasField(field) || (newSchema.hasField(field) && !narrowed)) {
                problems.add("Acknowledged removal '" + field + "' is neither removed nor narrowed by this change");
            }
        }
        
        if (!problems.isEmpty()) {
            throw new ValidationException("Invalid migration options", problems);
        }
    }
    
    private static List<String> messages(List<BreakingChange> changes) {
        return changes.stream().map(BreakingChange::getMessage).collect(Collectors.toList());
    }
}
