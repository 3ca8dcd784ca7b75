package com.shardstore.migration.exception;

/**
 * Exception thrown when the underlying store fails.
 * Retryable at the caller's discretion.
 */
public class RepositoryException extends MigrationException {
    
    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
