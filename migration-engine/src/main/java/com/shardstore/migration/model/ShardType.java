package com.shardstore.migration.model;

import com.shardstore.migration.infrastructure.persistence.converter.SchemaDefinitionConverter;
import com.shardstore.migration.schema.SchemaDefinition;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Schema-defining record type of a tenant.
 * Its schema and version change only when a migration is created.
 */
@Entity
@Table(name = "shard_types", indexes = {
    @Index(name = "idx_shard_type_tenant", columnList = "tenantId")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ShardType {

    @Id
    @Column(length = 128)
    private String id;

    @Column(nullable = false, length = 128)
    private String tenantId;

    @Column(nullable = false)
    private String name;

    @Builder.Default
    @Column(nullable = false)
    private int schemaVersion = 1;

    @Convert(converter = SchemaDefinitionConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private SchemaDefinition schema = SchemaDefinition.empty();

    /**
     * Migration currently holding the single running slot of this type, if any.
     */
    @Column(length = 64)
    private String runningMigrationId;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

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
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
