package com.shardstore.migration.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Compatibility verdict for a {@link SchemaDiff}. Informational; never thrown.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class CompatibilityResult {

    boolean compatible;

    @Builder.Default
    List<BreakingChange> breakingChanges = List.of();

    @Builder.Default
    List<String> recommendations = List.of();

    public List<String> getBreakingReasons() {
        return breakingChanges.stream().map(BreakingChange::getMessage).collect(Collectors.toList());
    }
}
