package com.shardstore.migration.exception;

import java.util.List;

/**
 * Exception thrown when a schema, a migration request or a breaking change
 * fails validation. Carries every reason found, not just the first one.
 */
public class ValidationException extends MigrationException {
    
    private final List<String> reasons;
    
    public ValidationException(String message) {
        super(message);
        this.reasons = List.of(message);
    }
    
    public ValidationException(String message, List<String> reasons) {
        super(reasons.isEmpty() ? message : message + ": " + String.join("; ", reasons));
        this.reasons = List.copyOf(reasons);
    }
    
    public List<String> getReasons() {
        return reasons;
    }
}
