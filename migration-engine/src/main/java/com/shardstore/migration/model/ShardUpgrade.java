package com.shardstore.migration.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A record payload brought forward in memory, not yet written.
 */
@Value
@Builder
public class ShardUpgrade {

    Map<String, Object> structuredData;

    int schemaVersion;

    @Builder.Default
    List<String> appliedMigrationIds = List.of();

    public boolean isChanged() {
        return !appliedMigrationIds.isEmpty();
    }
}
