package com.shardstore.migration.model;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ShardTypeRepository extends JpaRepository<ShardType, String> {
    
    Optional<ShardType> findByIdAndTenantId(String id, String tenantId);
}
