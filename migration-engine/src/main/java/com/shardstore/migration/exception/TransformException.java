package com.shardstore.migration.exception;

/**
 * Exception thrown when a single record cannot be transformed to the target schema.
 * Never aborts a batch; the record is counted as failed.
 */
public class TransformException extends MigrationException {
    
    public TransformException(String message) {
        super(message);
    }
    
    public TransformException(String message, Throwable cause) {
        super(message, cause);
    }
}
