package com.shardstore.migration.store;

public enum WriteResult {
    SUCCESS,
    CONFLICT
}
