package com.albumsocial.config;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.exception.FlywayValidateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 本地开发时经常改动已执行过的迁移脚本，checksum 不一致会让应用起不来。
 * 这里在 migrate 前先 validate，失败则 repair 后继续。
 */
@Configuration
@ConditionalOnProperty(name = "albumsocial.flyway.auto-repair", havingValue = "true", matchIfMissing = true)
public class FlywayAutoRepairConfig {
    private static final Logger log = LoggerFactory.getLogger(FlywayAutoRepairConfig.class);

    @Bean
    public FlywayMigrationStrategy flywayMigrationStrategy() {
        return flyway -> {
            validateOrRepair(flyway);
            flyway.migrate();
        };
    }

    static void validateOrRepair(Flyway flyway) {
        try {
            flyway.validate();
        } catch (FlywayValidateException e) {
            log.warn("Flyway: validate failed, running repair() before migrate()", e);
            try {
                flyway.repair();
            } catch (Exception repairError) {
                log.warn("Flyway: repair() failed, continue migrate()", repairError);
            }
        } catch (Exception e) {
            log.warn("Flyway: validate() failed, continue migrate()", e);
        }
    }
}
