package com.shardstore.migration.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A typed record of a ShardType. {@code structuredData} is the JSON payload as
 * written under {@code schemaVersion}; {@code revision} increases on every write.
 */
@Entity
@Table(name = "shards", indexes = {
    @Index(name = "idx_shard_type_version", columnList = "tenantId, shardTypeId, schemaVersion")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Shard {

    @Id
    @Column(length = 128)
    private String id;

    @Column(nullable = false, length = 128)
    private String tenantId;

    @Column(nullable = false, length = 128)
    private String shardTypeId;

    @Builder.Default
    @Column(nullable = false)
    private int schemaVersion = 1;

    @Builder.Default
    @Column(nullable = false)
    private long revision = 0;

    @Column(columnDefinition = "TEXT")
    private String structuredData;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

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
