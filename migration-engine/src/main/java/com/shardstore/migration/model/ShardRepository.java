package com.shardstore.migration.model;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ShardRepository extends JpaRepository<Shard, String> {
    
    /**
     * Keyset page of records below a schema version, ordered by ID.
     */
    List<Shard> findByTenantIdAndShardTypeIdAndSchemaVersionLessThanAndIdGreaterThanOrderByIdAsc(
            String tenantId, String shardTypeId, int belowVersion, String afterId, Pageable pageable);
    
    Optional<Shard> findByIdAndTenantId(String id, String tenantId);
    
    long countByTenantIdAndShardTypeIdAndSchemaVersionLessThan(
            String tenantId, String shardTypeId, int belowVersion);
    
    long countByTenantIdAndShardTypeIdAndSchemaVersion(
            String tenantId, String shardTypeId, int schemaVersion);
    
    /**
     * Rewrite a record only if nobody wrote it since it was read.
     *
     * @return 1 when written, 0 when the record changed or disappeared
     */
    @Modifying
    @Transactional
    @Query("UPDATE Shard s SET s.structuredData = :data, s.schemaVersion = :newVersion, "
            + "s.revision = s.revision + 1, s.updatedAt = :now "
            + "WHERE s.id = :id AND s.tenantId = :tenantId "
            + "AND s.schemaVersion = :expectedVersion AND s.revision = :expectedRevision")
    int updateIfUnchanged(
            @Param("id") String id,
            @Param("tenantId") String tenantId,
            @Param("data") String data,
            @Param("newVersion") int newVersion,
            @Param("expectedVersion") int expectedVersion,
            @Param("expectedRevision") long expectedRevision,
            @Param("now") LocalDateTime now);
}
