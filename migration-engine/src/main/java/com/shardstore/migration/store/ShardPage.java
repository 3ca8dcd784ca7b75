package com.shardstore.migration.store;

import lombok.Value;

import java.util.List;

/**
 * One page of records. {@code nextCursor} is null when no further page exists.
 */
@Value
public class ShardPage {

    List<ShardRecord> records;

    String nextCursor;

    public boolean hasMore() {
        return nextCursor != null;
    }
}
