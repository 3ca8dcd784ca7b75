package com.shardstore.migration.infrastructure.persistence;

import com.shardstore.migration.exception.ConflictException;
import com.shardstore.migration.exception.NotFoundException;
import com.shardstore.migration.exception.RepositoryException;
import com.shardstore.migration.model.MigrationStatus;
import com.shardstore.migration.model.SchemaMigration;
import com.shardstore.migration.model.SchemaMigrationRepository;
import com.shardstore.migration.store.MigrationRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * {@link MigrationRecordStore} backed by Spring Data JPA.
 * Status transitions are guarded by the entity's optimistic version.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JpaMigrationRecordStore implements MigrationRecordStore {
    
    private final SchemaMigrationRepository repository;
    
    @Override
    @Transactional
    public SchemaMigration create(SchemaMigration migration) {
        try {
            return repository.saveAndFlush(migration);
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("Migration " + migration.getId() + " already exists", e);
        } catch (DataAccessException e) {
            throw new RepositoryException("Failed to create migration " + migration.getId(), e);
        }
    }
    
    @Override
    @Transactional(readOnly = true)
    public SchemaMigration getById(String id, String tenantId) {
        return query("load migration " + id, () -> repository.findByIdAndTenantId(id, tenantId))
                .orElseThrow(() -> new NotFoundException("Migration not found: " + id));
    }
    
    @Override
    @Transactional
    public SchemaMigration updateStatus(
            String id,
            String tenantId,
            MigrationStatus expectedStatus,
            MigrationStatus newStatus,
            Consumer<SchemaMigration> patch) {
        
        SchemaMigration migration = getById(id, tenantId);
        
        if (migration.getStatus() != expectedStatus) {
            throw new ConflictException(String.format(
                    "Migration %s is %s, expected %s", id, migration.getStatus(), expectedStatus));
        }
        if (!expectedStatus.canTransitionTo(newStatus)) {
            throw new ConflictException(String.format(
                    "Migration %s cannot move from %s to %s", id, expectedStatus, newStatus));
        }
        
        if (patch != null) {
            patch.accept(migration);
        }
        migration.setStatus(newStatus);
        
        try {
            SchemaMigration saved = repository.saveAndFlush(migration);
            if (expectedStatus != newStatus) {
                log.info("[Migration-{}] Status updated: {} -> {}", id, expectedStatus, newStatus);
            }
            return saved;
        } catch (OptimisticLockingFailureException e) {
            throw new ConflictException("Migration " + id + " was updated concurrently", e);
        } catch (DataAccessException e) {
            throw new RepositoryException("Failed to update migration " + id, e);
        }
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<SchemaMigration> listByType(String tenantId, String shardTypeId) {
        return query("list migrations of type " + shardTypeId,
                () -> repository.findByTenantIdAndShardTypeIdOrderByFromVersionAscCreatedAtAsc(tenantId, shardTypeId));
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<SchemaMigration> listByTenant(String tenantId) {
        return query("list migrations of tenant " + tenantId,
                () -> repository.findByTenantIdOrderByCreatedAtDesc(tenantId));
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<SchemaMigration> listByTypeAndStatus(String tenantId, String shardTypeId, MigrationStatus status) {
        return query("list " + status + " migrations of type " + shardTypeId,
                () -> repository.findByTenantIdAndShardTypeIdAndStatus(tenantId, shardTypeId, status));
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<SchemaMigration> listInVersionRange(
            String tenantId, String shardTypeId, int fromVersion, int toVersion) {
        return query("list migrations of type " + shardTypeId + " in v" + fromVersion + "..v" + toVersion,
                () -> repository
                        .findByTenantIdAndShardTypeIdAndFromVersionGreaterThanEqualAndToVersionLessThanEqualOrderByFromVersionAsc(
                                tenantId, shardTypeId, fromVersion, toVersion));
    }
    
    private <T> T query(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new RepositoryException("Failed to " + operation, e);
        }
    }
}
