package com.shardstore.migration.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shardstore.migration.exception.RepositoryException;
import com.shardstore.migration.exception.TransformException;
import com.shardstore.migration.model.Shard;
import com.shardstore.migration.model.ShardRepository;
import com.shardstore.migration.store.RecordRepository;
import com.shardstore.migration.store.ShardPage;
import com.shardstore.migration.store.ShardRecord;
import com.shardstore.migration.store.WriteResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link RecordRepository} over the JPA {@code shards} table.
 * Pages are keyset-paginated on record ID.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JpaRecordRepository implements RecordRepository {
    
    private static final TypeReference<LinkedHashMap<String, Object>> DATA_TYPE = new TypeReference<>() { };
    
    private final ShardRepository shardRepository;
    private final ObjectMapper objectMapper;
    
    @Override
    @Transactional(readOnly = true)
    public ShardPage listByTypeAndVersion(
            String tenantId, String shardTypeId, int belowVersion, int pageSize, String cursor) {
        
        String afterId = ContinuationTokens.decode(cursor);
        List<Shard> shards;
        try {
            shards = shardRepository.findByTenantIdAndShardTypeIdAndSchemaVersionLessThanAndIdGreaterThanOrderByIdAsc(
                    tenantId, shardTypeId, belowVersion, afterId, PageRequest.of(0, pageSize));
        } catch (DataAccessException e) {
            throw new RepositoryException("Failed to list records of type " + shardTypeId, e);
        }
        
        List<ShardRecord> records = shards.stream().map(this::toRecord).collect(Collectors.toList());
        String nextCursor = records.size() < pageSize
                ? null
                : ContinuationTokens.encode(records.get(records.size() - 1).getId());
        
        log.debug("Listed {} record(s) of type {} below v{} (more: {})",
                records.size(), shardTypeId, belowVersion, nextCursor != null);
        return new ShardPage(records, nextCursor);
    }
    
    @Override
    @Transactional(readOnly = true)
    public Optional<ShardRecord> findById(String tenantId, String id) {
        try {
            return shardRepository.findByIdAndTenantId(id, tenantId).map(this::toRecord);
        } catch (DataAccessException e) {
            throw new RepositoryException("Failed to read record " + id, e);
        }
    }
    
    @Override
    @Transactional(noRollbackFor = TransformException.class)
    public WriteResult conditionalWrite(ShardRecord record, int expectedVersion) {
        String payload = serialize(record);
        try {
            int updated = shardRepository.updateIfUnchanged(
                    record.getId(),
                    record.getTenantId(),
                    payload,
                    record.getSchemaVersion(),
                    expectedVersion,
                    record.getRevision(),
                    LocalDateTime.now());
            return updated == 1 ? WriteResult.SUCCESS : WriteResult.CONFLICT;
        } catch (DataAccessException e) {
            throw new RepositoryException("Failed to write record " + record.getId(), e);
        }
    }
    
    @Override
    @Transactional(readOnly = true)
    public long countBelowVersion(String tenantId, String shardTypeId, int belowVersion) {
        try {
            return shardRepository.countByTenantIdAndShardTypeIdAndSchemaVersionLessThan(
                    tenantId, shardTypeId, belowVersion);
        } catch (DataAccessException e) {
            throw new RepositoryException("Failed to count records of type " + shardTypeId, e);
        }
    }
    
    private ShardRecord toRecord(Shard shard) {
        return ShardRecord.builder()
                .id(shard.getId())
                .tenantId(shard.getTenantId())
                .shardTypeId(shard.getShardTypeId())
                .schemaVersion(shard.getSchemaVersion())
                .revision(shard.getRevision())
                .structuredData(deserialize(shard))
                .build();
    }
    
    // An unreadable payload is a per-record problem; surfaced lazily when the record is transformed
    private Map<String, Object> deserialize(Shard shard) {
        if (shard.getStructuredData() == null || shard.getStructuredData().isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(shard.getStructuredData(), DATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Record {} holds unreadable structured data: {}", shard.getId(), e.getOriginalMessage());
            return null;
        }
    }
    
    private String serialize(ShardRecord record) {
        try {
            return objectMapper.writeValueAsString(record.getStructuredData());
        } catch (JsonProcessingException e) {
            throw new TransformException("Record " + record.getId() + " payload cannot be serialized", e);
        }
    }
}
