package com.shardstore.migration.schema;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Advisory rename suggestion: a removed field and an added field of the same
 * type whose names are similar. Never applied unless confirmed through a field mapping.
 */
@Value
@Builder
@Jacksonized
public class RenameCandidate {

    String from;

    String to;

    double similarity;
}
