package com.shardstore.migration.store;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Record view handed to the engine by the {@link RecordRepository}.
 * {@code revision} is the write counter observed when the record was read.
 */
@Value
@Builder(toBuilder = true)
public class ShardRecord {

    String id;

    String tenantId;

    String shardTypeId;

    int schemaVersion;

    long revision;

    Map<String, Object> structuredData;
}
