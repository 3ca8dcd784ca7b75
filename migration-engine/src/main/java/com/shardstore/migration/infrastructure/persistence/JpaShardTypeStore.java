package com.shardstore.migration.infrastructure.persistence;

import com.shardstore.migration.exception.ConflictException;
import com.shardstore.migration.exception.NotFoundException;
import com.shardstore.migration.exception.RepositoryException;
import com.shardstore.migration.model.ShardType;
import com.shardstore.migration.model.ShardTypeRepository;
import com.shardstore.migration.schema.SchemaDefinition;
import com.shardstore.migration.store.ShardTypeStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Objects;

/**
 * {@link ShardTypeStore} backed by Spring Data JPA.
 * Writes rely on the entity's optimistic version so concurrent writers cannot both win.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JpaShardTypeStore implements ShardTypeStore {
    
    private final ShardTypeRepository repository;
    
    @Override
    @Transactional(readOnly = true)
    public ShardType findById(String tenantId, String shardTypeId) {
        try {
            return repository.findByIdAndTenantId(shardTypeId, tenantId)
                    .orElseThrow(() -> new NotFoundException("ShardType not found: " + shardTypeId));
        } catch (DataAccessException e) {
            throw new RepositoryException("Failed to load ShardType " + shardTypeId, e);
        }
    }
    
    @Override
    @Transactional
    public ShardType bumpSchemaVersion(
            String tenantId, String shardTypeId, int expectedSchemaVersion, SchemaDefinition newSchema) {
        
        ShardType shardType = findById(tenantId, shardTypeId);
        if (shardType.getSchemaVersion() != expectedSchemaVersion) {
            throw new ConflictException(String.format(
                    "ShardType %s is at schema v%d, expected v%d",
                    shardTypeId, shardType.getSchemaVersion(), expectedSchemaVersion));
        }
        
        shardType.setSchema(newSchema);
        shardType.setSchemaVersion(expectedSchemaVersion + 1);
        ShardType saved = save(shardType);
        log.info("ShardType {} schema bumped to v{}", shardTypeId, saved.getSchemaVersion());
        return saved;
    }
    
    @Override
    @Transactional
    public ShardType acquireRunningSlot(String tenantId, String shardTypeId, String migrationId) {
        ShardType shardType = findById(tenantId, shardTypeId);
        String holder = shardType.getRunningMigrationId();
        
        if (migrationId.equals(holder)) {
            return shardType;
        }
        if (holder != null) {
            throw new ConflictException(String.format(
                    "ShardType %s already has running migration %s", shardTypeId, holder));
        }
        
        shardType.setRunningMigrationId(migrationId);
        return save(shardType);
    }
    
    @Override
    @Transactional
    public void releaseRunningSlot(String tenantId, String shardTypeId, String migrationId) {
        ShardType shardType = findById(tenantId, shardTypeId);
        if (!Objects.equals(shardType.getRunningMigrationId(), migrationId)) {
            return;
        }
        shardType.setRunningMigrationId(null);
        save(shardType);
    }
    
    private ShardType save(ShardType shardType) {
        try {
            return repository.saveAndFlush(shardType);
        } catch (OptimisticLockingFailureException e) {
            throw new ConflictException("ShardType " + shardType.getId() + " was updated concurrently", e);
        } catch (DataAccessException e) {
            throw new RepositoryException("Failed to save ShardType " + shardType.getId(), e);
        }
    }
}
