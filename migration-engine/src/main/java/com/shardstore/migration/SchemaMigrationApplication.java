package com.shardstore.migration;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Main application class for the schema migration engine.
 */
@SpringBootApplication
@EnableJpaRepositories
public class SchemaMigrationApplication {

    public static void main(String[] args) {
        SpringApplication.run(SchemaMigrationApplication.class, args);
    }
}
