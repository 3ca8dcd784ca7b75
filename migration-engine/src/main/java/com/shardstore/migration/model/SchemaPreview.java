package com.shardstore.migration.model;

import com.shardstore.migration.schema.CompatibilityResult;
import com.shardstore.migration.schema.SchemaDiff;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of previewing a schema change before committing it.
 */
@Value
@Builder
public class SchemaPreview {

    String shardTypeId;

    int currentVersion;

    SchemaDiff diff;

    CompatibilityResult compatibility;

    String summary;

    MigrationStrategy recommendedStrategy;

    /**
     * Breaking reasons the supplied options do not resolve. Creation would fail unless empty.
     */
    @Builder.Default
    List<String> unresolvedReasons = List.of();
}
