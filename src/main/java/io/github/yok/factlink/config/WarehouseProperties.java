package io.github.yok.factlink.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code warehouse} section in {@code application.yml}.
 *
 * <pre>
 * warehouse:
 *   connection:
 *     url: jdbc:postgresql://localhost:5432/warehouse
 *     user: loader
 *     password: secret
 *     driver-class: org.postgresql.Driver
 *   pool:
 *     minimum-idle: 2
 *     maximum-size: 10
 *     connection-timeout: 5s
 *     max-retries: 3
 *   batch-size: 1000
 * </pre>
 *
 * <p>
 * Every value can be overridden by environment variables through Spring Boot relaxed binding (for
 * example {@code WAREHOUSE_POOL_MAXIMUM_SIZE} or {@code WAREHOUSE_BATCH_SIZE}).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "warehouse")
@Data
public class WarehouseProperties {

    /**
     * JDBC connection settings.
     */
    private Connection connection = new Connection();

    /**
     * Connection pool and retry settings.
     */
    private Pool pool = new Pool();

    /**
     * Number of records per chunk written by the loader.
     */
    private int batchSize = 1000;

    /**
     * JDBC connection settings of the warehouse.
     */
    @Data
    public static class Connection {
        // JDBC connection URL (e.g., jdbc:postgresql://localhost:5432/warehouse)
        private String url;
        // Database user name
        private String user;
        // Database password
        private String password;
        // Fully qualified JDBC driver class name
        private String driverClass = "org.postgresql.Driver";
    }

    /**
     * Pool sizing, acquisition timeout and retry backoff.
     */
    @Data
    public static class Pool {
        // Minimum number of idle connections kept open
        private int minimumIdle = 2;
        // Upper bound of live connections
        private int maximumSize = 10;
        // Time one acquisition attempt may block waiting for a connection
        private Duration connectionTimeout = Duration.ofSeconds(5);
        // Retries after the first failed acquisition (transient errors only)
        private int maxRetries = 3;
        // Backoff before the first retry
        private Duration initialBackoff = Duration.ofMillis(200);
        // Growth factor applied to the backoff after each retry
        private double backoffMultiplier = 2.0;
        // Upper bound of a single backoff
        private Duration maxBackoff = Duration.ofSeconds(5);
        // Extra driver properties (e.g., stringtype=unspecified)
        private Map<String, String> dataSourceProperties = new LinkedHashMap<>();
    }
}
