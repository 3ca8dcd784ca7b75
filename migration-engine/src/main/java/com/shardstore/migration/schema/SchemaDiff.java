package com.shardstore.migration.schema;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.shardstore.migration.model.MigrationStrategy;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Structural difference between two {@link SchemaDefinition}s.
 * Never persisted on its own; snapshotted on a migration for audit.
 */
@Value
@Builder
@Jacksonized
public class SchemaDiff {

    @Builder.Default
    List<FieldChange> added = List.of();

    @Builder.Default
    List<FieldChange> removed = List.of();

    @Builder.Default
    List<FieldChange> modified = List.of();

    @Builder.Default
    List<RenameCandidate> renamed = List.of();

    public static SchemaDiff empty() {
        return SchemaDiff.builder().build();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && modified.isEmpty();
    }

    @JsonIgnore
    public int getTotalChanges() {
        return added.size() + removed.size() + modified.size();
    }

    public Optional<FieldChange> findAdded(String field) {
        return added.stream().filter(change -> change.getField().equals(field)).findFirst();
    }

    public Optional<FieldChange> findRemoved(String field) {
        return removed.stream().filter(change -> change.getField().equals(field)).findFirst();
    }

    public Optional<FieldChange> findModified(String field) {
        return modified.stream().filter(change -> change.getField().equals(field)).findFirst();
    }

    /**
     * Whether existing records have to be rewritten to conform to the new schema.
     * Adding optional fields, relaxing required flags and widening value lists do not.
     */
    @JsonIgnore
    public boolean requiresDataRewrite() {
        if (!removed.isEmpty()) {
            return true;
        }
        if (added.stream().anyMatch(change -> change.getAfter().isRequired())) {
            return true;
        }
        return modified.stream().anyMatch(change -> change.isTypeChanged()
                || change.isMadeRequired()
                || !change.getRemovedAllowedValues().isEmpty());
    }

    @JsonIgnore
    public MigrationStrategy recommendedStrategy() {
        return requiresDataRewrite() ? MigrationStrategy.EAGER : MigrationStrategy.LAZY;
    }

    /**
     * Human-readable one-line summary of the diff.
     */
    public String summary() {
        if (isEmpty()) {
            return "No schema changes detected.";
        }
        List<String> parts = new ArrayList<>();
        parts.add(getTotalChanges() + " change(s) detected:");
        if (!added.isEmpty()) {
            parts.add(added.size() + " field(s) added");
        }
        if (!removed.isEmpty()) {
            parts.add(removed.size() + " field(s) removed");
        }
        long typeChanges = modified.stream().filter(FieldChange::isTypeChanged).count();
        if (typeChanges > 0) {
            parts.add(typeChanges + " field type(s) changed");
        }
        long requiredChanges = modified.stream()
                .filter(change -> change.isMadeRequired() || change.isMadeOptional())
                .count();
        if (requiredChanges > 0) {
            parts.add(requiredChanges + " required status change(s)");
        }
        if (!renamed.isEmpty()) {
            parts.add(renamed.size() + " possible rename(s)");
        }
        return String.join(" ", parts);
    }
}
