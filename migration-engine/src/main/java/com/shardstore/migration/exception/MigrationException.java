package com.shardstore.migration.exception;

/**
 * Base exception for all schema migration errors.
 */
public class MigrationException extends RuntimeException {
    
    public MigrationException(String message) {
        super(message);
    }
    
    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
