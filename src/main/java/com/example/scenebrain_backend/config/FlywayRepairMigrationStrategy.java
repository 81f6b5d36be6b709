package com.example.scenebrain_backend.config;

import org.flywaydb.core.Flyway;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Flyway strategy that repairs checksum mismatches of the memory and scene tables before running
 * migrations, so environments that applied an edited script keep starting.
 */
@Configuration
public class FlywayRepairMigrationStrategy {

    /**
     * Repairs the schema history and then executes pending migrations.
     *
     * @return strategy that invokes {@link Flyway#repair()} prior to {@link Flyway#migrate()}.
     */
    @Bean
    public FlywayMigrationStrategy repairThenMigrateStrategy() {
        return flyway -> {
            flyway.repair();
            flyway.migrate();
        };
    }
}
