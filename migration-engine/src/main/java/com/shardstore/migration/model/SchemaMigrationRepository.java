package com.shardstore.migration.model;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SchemaMigrationRepository extends JpaRepository<SchemaMigration, String> {
    
    Optional<SchemaMigration> findByIdAndTenantId(String id, String tenantId);
    
    /**
     * All migrations of a ShardType, oldest version first.
     */
    List<SchemaMigration> findByTenantIdAndShardTypeIdOrderByFromVersionAscCreatedAtAsc(
            String tenantId, String shardTypeId);
    
    List<SchemaMigration> findByTenantIdOrderByCreatedAtDesc(String tenantId);
    
    List<SchemaMigration> findByTenantIdAndShardTypeIdAndStatus(
            String tenantId, String shardTypeId, MigrationStatus status);
    
    /**
     * Migrations of a ShardType within a version window, used to resolve upgrade paths.
     */
    List<SchemaMigration> findByTenantIdAndShardTypeIdAndFromVersionGreaterThanEqualAndToVersionLessThanEqualOrderByFromVersionAsc(
            String tenantId, String shardTypeId, int fromVersion, int toVersion);
}
