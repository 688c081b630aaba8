package com.di.repartition.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Catalog connection pool. Only created when {@code repartition.database.url} is set; without it the
 * application still validates plan documents offline.
 */
@Slf4j
@Configuration
public class DataSourceConfig {

    private static final AtomicInteger POOL_IDS = new AtomicInteger(0);

    @Bean(destroyMethod = "close")
    @ConditionalOnExpression("!'${repartition.database.url:}'.isBlank()")
    public HikariDataSource catalogDataSource(RepartitionProperties properties) {
        return createPool(properties.getDatabase().toSnapshot());
    }

    static HikariDataSource createPool(DbConfigSnapshot snapshot) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(snapshot.jdbcUrl());
        hikariConfig.setUsername(snapshot.username());
        hikariConfig.setPassword(snapshot.password());
        hikariConfig.setDriverClassName(snapshot.driverClassName());
        hikariConfig.setMaximumPoolSize(Math.max(1, snapshot.maximumPoolSize()));
        hikariConfig.setMinimumIdle(Math.min(snapshot.minimumIdle(), Math.max(1, snapshot.maximumPoolSize())));
        hikariConfig.setIdleTimeout(snapshot.idleTimeoutMs());
        hikariConfig.setConnectionTimeout(snapshot.connectionTimeoutMs());
        hikariConfig.setMaxLifetime(snapshot.maxLifetimeMs());
        // catalog reads only; sessions are never used for DML
        hikariConfig.setReadOnly(true);
        hikariConfig.setAutoCommit(true);
        // start without a reachable database; the first open() reports the failure
        hikariConfig.setInitializationFailTimeout(-1);
        hikariConfig.setPoolName("CatalogPool-" + POOL_IDS.incrementAndGet());

        log.info("[SESSION] Creating catalog pool | url={} | user={} | maxPoolSize={}",
                snapshot.sanitizedUrl(), snapshot.username(), hikariConfig.getMaximumPoolSize());
        return new HikariDataSource(hikariConfig);
    }
}
