package com.shardstore.migration.exception;

/**
 * Exception thrown when a ShardType, a migration or a migration path hop does not exist.
 */
public class NotFoundException extends MigrationException {
    
    public NotFoundException(String message) {
        super(message);
    }
}
