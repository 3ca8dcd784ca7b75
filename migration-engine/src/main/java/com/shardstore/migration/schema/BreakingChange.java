package com.shardstore.migration.schema;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One reason a schema change is incompatible with existing records,
 * with a hint on how a migration request can resolve it.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BreakingChange {

    String field;

    BreakingChangeKind kind;

    String message;

    String resolution;

    /**
     * Counterpart field for {@link BreakingChangeKind#POSSIBLE_RENAME} (the suggested new name).
     */
    String relatedField;
}
