package com.jonathantong.SensorRelay.config;

import com.jonathantong.SensorRelay.model.ConnectionDescriptor;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Database configuration for the Home Assistant recorder database.
 * The same connection descriptor feeds the JDBC pool and the binlog client.
 */
@Configuration
public class DatabaseConfig {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseConfig.class);

    @Value("${sensorrelay.db.url}")
    private String databaseUrl;

    @Value("${sensorrelay.db.pool.maximum-size:5}")
    private int maximumPoolSize;

    /**
     * Parsed connection settings shared by JDBC and replication
     */
    @Bean
    public ConnectionDescriptor connectionDescriptor() {
        ConnectionDescriptor descriptor = ConnectionDescriptor.parse(databaseUrl);
        logger.info("Source database: {}", descriptor);
        return descriptor;
    }

    /**
     * Source database DataSource
     */
    @Bean
    public DataSource sourceDataSource(ConnectionDescriptor descriptor) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(descriptor.toJdbcUrl());
        config.setUsername(descriptor.getUsername());
        config.setPassword(descriptor.getPassword());
        config.setDriverClassName("org.mariadb.jdbc.Driver");

        // Connection pool settings
        config.setMaximumPoolSize(maximumPoolSize);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(30000);
        config.setIdleTimeout(600000);
        config.setMaxLifetime(1800000);

        // Start even if the database is down; the stream supervisor retries on its own
        config.setInitializationFailTimeout(-1);

        // Connection validation
        config.setConnectionTestQuery("SELECT 1");
        config.setValidationTimeout(5000);

        config.setPoolName("SourceDB-Pool");

        return new HikariDataSource(config);
    }

    /**
     * JdbcTemplate for source database
     */
    @Bean
    public JdbcTemplate sourceJdbcTemplate(DataSource sourceDataSource) {
        return new JdbcTemplate(sourceDataSource);
    }
}
