package com.shardstore.migration.exception;

/**
 * Exception thrown when an operation races another writer or is not
 * allowed in the migration's current status.
 */
public class ConflictException extends MigrationException {
    
    public ConflictException(String message) {
        super(message);
    }
    
    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
