package com.lusta.config;

import lombok.extern.slf4j.Slf4j;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.exception.FlywayValidateException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 开发期常见问题：改过已执行的 V1__init.sql 导致 checksum 不一致，启动直接失败。
 *
 * <p>这里先 validate，失败时 repair 一次再 migrate；生产环境可用 im.flyway.auto-repair=false 关闭。</p>
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "im.flyway.auto-repair", havingValue = "true", matchIfMissing = true)
public class FlywayAutoRepairConfig {

    @Bean
    public FlywayMigrationStrategy flywayMigrationStrategy() {
        return flyway -> {
            validateOrRepair(flyway);
            int applied = flyway.migrate().migrationsExecuted;
            MigrationInfo current = flyway.info().current();
            log.info("Flyway: applied {} migration(s), schema version={}",
                    applied, current == null ? "<none>" : current.getVersion());
        };
    }

    private static void validateOrRepair(Flyway flyway) {
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
