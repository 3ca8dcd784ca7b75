package com.shardstore.migration.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for schema migration operations.
 */
@Configuration
@ConfigurationProperties(prefix = "schema-migration")
@Data
public class MigrationProperties {
    
    /**
     * Batch execution configuration.
     */
    private BatchConfig batch = new BatchConfig();
    
    /**
     * Rename detection configuration.
     */
    private RenameConfig rename = new RenameConfig();
    
    /**
     * Compatibility classification configuration.
     */
    private CompatibilityConfig compatibility = new CompatibilityConfig();
    
    @Data
    public static class BatchConfig {
        /**
         * Number of records processed by a single run invocation.
         */
        private int pageSize = 200;
        
        /**
         * Maximum number of failed record IDs kept on a migration.
         * Oldest entries are evicted first.
         */
        private int failureSampleSize = 100;
    }
    
    @Data
    public static class RenameConfig {
        /**
         * Minimum normalized name similarity (0.0 - 1.0) for a removed/added
         * field pair to be suggested as a rename.
         */
        private double similarityThreshold = 0.75;
    }
    
    @Data
    public static class CompatibilityConfig {
        /**
         * Treat documented type widenings (integer to float, etc.) as non-breaking.
         */
        private boolean allowWidening = false;
    }
}
