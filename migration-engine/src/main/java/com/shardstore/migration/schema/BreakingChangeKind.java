package com.shardstore.migration.schema;

/**
 * Category of an incompatible schema change.
 */
public enum BreakingChangeKind {
    REQUIRED_FIELD_ADDED,
    FIELD_REMOVED,
    TYPE_CHANGED,
    MADE_REQUIRED,
    ALLOWED_VALUE_REMOVED,
    POSSIBLE_RENAME
}
