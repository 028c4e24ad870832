package com.cypher.bridge.graph;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates HikariCP pools for AGE-enabled PostgreSQL servers.
 */
public final class AgeDataSourceFactory {
    private static final Logger log = LoggerFactory.getLogger(AgeDataSourceFactory.class);

    static final String DRIVER_CLASS_NAME = "org.postgresql.Driver";

    private AgeDataSourceFactory() {
        // utility class
    }

    /**
     * Opens a pool for {@code config}. The caller owns the returned pool and must close it.
     */
    public static HikariDataSource create(AgeConnectionConfig config) {
        HikariDataSource dataSource = new HikariDataSource(buildHikariConfig(config));
        log.info("AGE connection pool started url={} graph={}", config.jdbcUrl(), config.getGraphName());
        return dataSource;
    }

    public static HikariConfig buildHikariConfig(AgeConnectionConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setExceptionOverrideClassName(AgeSqlExceptionOverride.class.getName());
        hikari.setDriverClassName(DRIVER_CLASS_NAME);
        hikari.setJdbcUrl(config.jdbcUrl());
        hikari.setUsername(config.getUser());
        hikari.setPassword(config.getPassword());
        if (config.getApplicationName() != null && !config.getApplicationName().isBlank()) {
            // mapped by pgjdbc to pg_stat_activity.application_name
            hikari.addDataSourceProperty("ApplicationName", config.getApplicationName());
        }
        hikari.setConnectionTimeout(config.getConnectionTimeoutMillis());
        hikari.setMaximumPoolSize(config.getMaxPoolSize());
        hikari.setMinimumIdle(config.getMinIdle());
        hikari.setPoolName("cypher-bridge-" + config.getGraphName());
        hikari.setRegisterMbeans(false);
        return hikari;
    }
}
