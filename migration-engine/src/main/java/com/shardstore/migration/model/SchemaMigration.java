package com.shardstore.migration.model;

import com.shardstore.migration.infrastructure.persistence.converter.SchemaDefinitionConverter;
import com.shardstore.migration.infrastructure.persistence.converter.SchemaDiffConverter;
import com.shardstore.migration.infrastructure.persistence.converter.StringListConverter;
import com.shardstore.migration.infrastructure.persistence.converter.StringMapConverter;
import com.shardstore.migration.infrastructure.persistence.converter.TransformationMapConverter;
import com.shardstore.migration.infrastructure.persistence.converter.ValueMapConverter;
import com.shardstore.migration.schema.SchemaDefinition;
import com.shardstore.migration.schema.SchemaDiff;
import com.shardstore.migration.transform.BuiltInTransformation;
import com.shardstore.migration.transform.TransformPlan;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One version-to-version schema change of a ShardType and its execution state.
 * Never deleted; the rows form the audit trail of the type's schema history.
 * Only status, cursor and counters change after creation, always through a
 * version-checked write.
 */
@Entity
@Table(name = "schema_migrations", indexes = {
    @Index(name = "idx_migration_type", columnList = "tenantId, shardTypeId, fromVersion"),
    @Index(name = "idx_migration_tenant", columnList = "tenantId"),
    @Index(name = "idx_migration_status", columnList = "status")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SchemaMigration {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 128)
    private String tenantId;

    @Column(nullable = false, length = 128)
    private String shardTypeId;

    @Column(nullable = false)
    private int fromVersion;

    @Column(nullable = false)
    private int toVersion;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private MigrationStrategy strategy;

    /**
     * Schema in force before this migration. Kept for audit.
     */
    @Convert(converter = SchemaDefinitionConverter.class)
    @Column(columnDefinition = "TEXT")
    private SchemaDefinition fromSchema;

    @Convert(converter = SchemaDefinitionConverter.class)
    @Column(columnDefinition = "TEXT")
    private SchemaDefinition toSchema;

    /**
     * Diff snapshot taken at creation time.
     */
    @Convert(converter = SchemaDiffConverter.class)
    @Column(columnDefinition = "TEXT")
    private SchemaDiff diff;

    /**
     * Old field name to new field name.
     */
    @Convert(converter = StringMapConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, String> fieldMappings = new LinkedHashMap<>();

    /**
     * New field name to fill value.
     */
    @Convert(converter = ValueMapConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, Object> defaultValues = new LinkedHashMap<>();

    @Convert(converter = TransformationMapConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, BuiltInTransformation> typeTransformations = new LinkedHashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private MigrationStatus status;

    /**
     * Opaque continuation token of the next page to process.
     */
    @Column(name = "continuation_cursor", length = 512)
    private String cursor;

    @Builder.Default
    private long processedCount = 0;

    @Builder.Default
    private long failedCount = 0;

    /**
     * Records below the target version when execution started.
     */
    private Long totalShards;

    /**
     * Bounded sample of the most recent failed record IDs.
     */
    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private List<String> failedShardIds = new ArrayList<>();

    /**
     * Records that lost a write race during the main pass, re-attempted once before completion.
     */
    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private List<String> retryShardIds = new ArrayList<>();

    @Column(columnDefinition = "TEXT")
    private String lastError;

    @Column(nullable = false, length = 128)
    private String createdBy;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    /**
     * Timestamp when the migration reached a terminal status.
     */
    private LocalDateTime completedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
        if (status == null) {
            status = MigrationStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
        if (status != null && status.isTerminal() && completedAt == null) {
            completedAt = updatedAt;
        }
    }

    /**
     * Add a batch of progress and keep only the most recent {@code sampleSize} failed IDs.
     */
    public void recordProgress(long processed, Collection<String> failedIds, int sampleSize) {
        this.processedCount += processed;
        this.failedCount += failedIds.size();

        List<String> sample = new ArrayList<>(failedShardIds == null ? List.of() : failedShardIds);
        sample.addAll(failedIds);
        int overflow = sample.size() - Math.max(sampleSize, 0);
        if (overflow > 0) {
            sample.subList(0, overflow).clear();
        }
        this.failedShardIds = sample;
    }

    public TransformPlan toTransformPlan() {
        return TransformPlan.builder()
                .fieldMappings(fieldMappings == null ? Map.of() : fieldMappings)
                .defaultValues(defaultValues == null ? Map.of() : defaultValues)
                .typeTransformations(typeTransformations == null ? Map.of() : typeTransformations)
                .diff(diff == null ? SchemaDiff.empty() : diff)
                .build();
    }
}
