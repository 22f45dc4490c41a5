package com.example.riskscan_backend.config;

import org.flywaydb.core.Flyway;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;

/**
 * Repairs checksum mismatches in the Flyway history before migrating, so a locally edited
 * migration does not block startup of a developer database.
 */
@Configuration
public class FlywayRepairMigrationStrategy {

    /**
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
