package com.shardstore.migration.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a schema migration. Transitions only move forward.
 */
public enum MigrationStatus {
    // Initial state
    PENDING("Pending", false, false),
    
    // Batches are being applied
    RUNNING("Running", false, false),
    
    // Terminal states
    COMPLETED("Completed", true, false),
    COMPLETED_WITH_ERRORS("Completed With Errors", true, true),
    CANCELLED("Cancelled", true, false),
    FAILED("Failed", true, true);

    private final String displayName;
    private final boolean isTerminal;
    private final boolean isError;

    MigrationStatus(String displayName, boolean isTerminal, boolean isError) {
        this.displayName = displayName;
        this.isTerminal = isTerminal;
        this.isError = isError;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isTerminal() {
        return isTerminal;
    }

    public boolean isError() {
        return isError;
    }

    /**
     * Whether a run or cancel request may still act on a migration in this status.
     */
    public boolean isActive() {
        return this == PENDING || this == RUNNING;
    }

    /**
     * Whether moving from this status to {@code target} is a legal transition.
     * RUNNING to RUNNING is allowed so progress can be persisted between batches.
     */
    public boolean canTransitionTo(MigrationStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<MigrationStatus> allowedTargets() {
        switch (this) {
            case PENDING:
                return EnumSet.of(RUNNING, CANCELLED);
            case RUNNING:
                return EnumSet.of(RUNNING, COMPLETED, COMPLETED_WITH_ERRORS, FAILED, CANCELLED);
            default:
                return EnumSet.noneOf(MigrationStatus.class);
        }
    }
}
