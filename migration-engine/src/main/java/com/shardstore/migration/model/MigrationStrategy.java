package com.shardstore.migration.model;

/**
 * How existing records are brought to a new schema version.
 */
public enum MigrationStrategy {
    /**
     * Rewrite every record now through resumable batch runs.
     */
    EAGER,

    /**
     * Upgrade each record when it is next read.
     */
    LAZY
}
