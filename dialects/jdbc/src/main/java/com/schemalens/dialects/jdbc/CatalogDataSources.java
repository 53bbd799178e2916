package com.schemalens.dialects.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds connection pools for catalog reads. Every extraction uses one connection of its own,
 * so pools stay small.
 */
public final class CatalogDataSources {
    private static final Logger logger = LoggerFactory.getLogger(CatalogDataSources.class);

    private CatalogDataSources() {}

    public static HikariDataSource open(JdbcDialect dialect, ConnectionSettings settings, int maxConnections) {
        String url = dialect.jdbcUrl(settings.validate());
        logger.info("Connecting to {} at {}", dialect.engine().displayName(), url);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setDriverClassName(dialect.driverClass());
        if (settings.user() != null) {
            config.setUsername(settings.user());
        }
        if (settings.password() != null) {
            config.setPassword(settings.password());
        }
        config.setMaximumPoolSize(Math.max(1, maxConnections));
        config.setMinimumIdle(0);
        config.setPoolName("schemalens-" + dialect.engine().id());
        dialect.configure(config);
        return new HikariDataSource(config);
    }
}
