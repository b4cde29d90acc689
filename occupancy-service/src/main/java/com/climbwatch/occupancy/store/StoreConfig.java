package com.climbwatch.occupancy.store;

import com.climbwatch.occupancy.config.OccupancyProperties;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * Picks the storage backend from occupancy.storage.mode (MEMORY or JDBC).
 */
@Configuration
@Slf4j
public class StoreConfig {

    @Bean
    @ConditionalOnProperty(prefix = "occupancy.storage", name = "mode", havingValue = "memory", matchIfMissing = true)
    public BranchStore inMemoryBranchStore() {
        log.info("Storage mode MEMORY: readings are kept in process only");
        return new InMemoryBranchStore();
    }

    @Configuration
    @ConditionalOnProperty(prefix = "occupancy.storage", name = "mode", havingValue = "jdbc")
    static class JdbcStoreConfig {

        /**
         * Cloud SQL MySQL pool through the socket factory connector.
         * Fails startup when any required DB_* setting is missing.
         */
        @Bean
        public DataSource dataSource(OccupancyProperties properties) {
            OccupancyProperties.Database db = properties.getDatabase();
            String user = require(db.getUser(), "DB_USER");
            String password = require(db.getPassword(), "DB_PASS");
            String name = require(db.getName(), "DB_NAME");
            String instance = require(db.getInstanceConnectionName(), "INSTANCE_CONNECTION_NAME");

            HikariConfig config = new HikariConfig();
            config.setJdbcUrl("jdbc:mysql:///" + name);
            config.setUsername(user);
            config.setPassword(password);
            config.setMaximumPoolSize(db.getMaxPoolSize());
            config.addDataSourceProperty("socketFactory", "com.google.cloud.sql.mysql.SocketFactory");
            config.addDataSourceProperty("cloudSqlInstance", instance);
            config.addDataSourceProperty("ipTypes", db.isPrivateIp() ? "PRIVATE" : "PUBLIC,PRIVATE");

            log.info("Storage mode JDBC: Cloud SQL instance {}, database {}{}",
                    instance, name, db.isPrivateIp() ? " (private IP)" : "");
            return new HikariDataSource(config);
        }

        @Bean
        public JdbcTemplate jdbcTemplate(DataSource dataSource) {
            return new JdbcTemplate(dataSource);
        }

        @Bean
        public PlatformTransactionManager transactionManager(DataSource dataSource) {
            return new DataSourceTransactionManager(dataSource);
        }

        @Bean
        public BranchStore jdbcBranchStore(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager,
                                           OccupancyProperties properties) {
            return new JdbcBranchStore(jdbcTemplate, new TransactionTemplate(transactionManager),
                    properties.getStorage().getTimestampOffset());
        }

        private static String require(String value, String envName) {
            if (value == null || value.isBlank()) {
                throw new IllegalStateException(envName + " environment variable not set");
            }
            return value;
        }
    }
}
