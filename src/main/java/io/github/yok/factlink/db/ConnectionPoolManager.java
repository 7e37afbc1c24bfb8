package io.github.yok.factlink.db;

import com.google.common.math.LongMath;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.github.yok.factlink.config.WarehouseProperties;
import io.github.yok.factlink.error.ConfigurationException;
import io.github.yok.factlink.error.PoolExhaustedException;
import io.github.yok.factlink.error.WarehouseConnectionException;
import io.github.yok.factlink.error.WarehouseWriteException;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

/**
 * Owns the bounded set of live warehouse connections.
 *
 * <p>
 * Backed by HikariCP. Acquisition is retried with exponential backoff through Spring Retry, but
 * only for failures that {@link TransientErrorClassifier} considers transient. Authentication
 * failures, unknown hosts and similar problems propagate immediately as
 * {@link WarehouseConnectionException}. When the retry budget runs out a
 * {@link PoolExhaustedException} is raised.
 * </p>
 *
 * <p>
 * The constructor performs one health check and fails fast if the database is unreachable.
 * </p>
 *
 * <p>
 * This is the only write-path object that is safe for concurrent use across threads.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ConnectionPoolManager implements AutoCloseable {

    private static final String HEALTH_CHECK_SQL = "SELECT 1";
    // Timeouts at or above this are treated as "no deadline"
    private static final Duration UNBOUNDED_TIMEOUT = Duration.ofNanos(Long.MAX_VALUE);

    private final DataSource dataSource;
    private final WarehouseProperties.Pool pool;
    private final TransientErrorClassifier classifier;

    // Backoff sleeper (replaceable in tests)
    private final Sleeper sleeper;

    /**
     * Creates a HikariCP-backed pool from configuration and verifies connectivity.
     *
     * @param properties warehouse settings
     * @throws ConfigurationException if the connection settings are incomplete
     * @throws WarehouseConnectionException if the database is unreachable
     */
    public ConnectionPoolManager(WarehouseProperties properties) {
        this(createDataSource(properties), properties.getPool(), new TransientErrorClassifier(),
                new ThreadWaitSleeper());
    }

    /**
     * Creates a pool manager over an existing data source and verifies connectivity.
     *
     * @param dataSource connection source
     * @param pool retry settings
     * @param classifier transient error classifier
     * @param sleeper backoff sleeper
     */
    ConnectionPoolManager(DataSource dataSource, WarehouseProperties.Pool pool,
            TransientErrorClassifier classifier, Sleeper sleeper) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        try {
            runHealthQuery();
        } catch (SQLException | WarehouseWriteException e) {
            close();
            throw new WarehouseConnectionException(
                    "Database health check failed at startup: " + e.getMessage(), e);
        }
        log.info("Connection pool ready (minimumIdle={}, maximumSize={}, maxRetries={})",
                pool.getMinimumIdle(), pool.getMaximumSize(), pool.getMaxRetries());
    }

    /**
     * Builds the HikariCP data source.
     *
     * @param properties warehouse settings
     * @return data source; the pool opens connections lazily
     */
    static HikariDataSource createDataSource(WarehouseProperties properties) {
        WarehouseProperties.Connection conn = properties.getConnection();
        WarehouseProperties.Pool pool = properties.getPool();
        if (conn == null || StringUtils.isBlank(conn.getUrl())) {
            throw new ConfigurationException("warehouse.connection.url is required");
        }
        if (pool.getMinimumIdle() < 0 || pool.getMaximumSize() < 1
                || pool.getMinimumIdle() > pool.getMaximumSize()) {
            throw new ConfigurationException("Invalid pool size: minimumIdle="
                    + pool.getMinimumIdle() + ", maximumSize=" + pool.getMaximumSize());
        }
        if (pool.getMaxRetries() < 0) {
            throw new ConfigurationException("warehouse.pool.max-retries must not be negative");
        }

        HikariConfig config = new HikariConfig();
        config.setPoolName("factlink");
        config.setJdbcUrl(conn.getUrl());
        config.setUsername(conn.getUser());
        config.setPassword(conn.getPassword());
        if (StringUtils.isNotBlank(conn.getDriverClass())) {
            config.setDriverClassName(conn.getDriverClass());
        }
        config.setMinimumIdle(pool.getMinimumIdle());
        config.setMaximumPoolSize(pool.getMaximumSize());
        config.setConnectionTimeout(pool.getConnectionTimeout().toMillis());
        // Connectivity is verified by our own health check with retry
        config.setInitializationFailTimeout(-1);
        pool.getDataSourceProperties().forEach(config::addDataSourceProperty);
        return new HikariDataSource(config);
    }

    /**
     * Acquires a connection without a caller deadline.
     *
     * @return live connection; return it with {@link #release(Connection)}
     * @throws PoolExhaustedException if transient failures outlast the retry budget
     * @throws WarehouseConnectionException on a non-transient failure
     */
    public Connection acquire() {
        return acquire(null);
    }

    /**
     * Acquires a connection, retrying transient failures until either the retry count or the
     * caller-supplied timeout runs out. A retry whose backoff would end past the deadline is not
     * attempted.
     *
     * @param timeout overall deadline for acquisition including backoff, or {@code null}
     * @return live connection; return it with {@link #release(Connection)}
     * @throws PoolExhaustedException if transient failures outlast the retry budget
     * @throws WarehouseConnectionException on a non-transient failure
     */
    public Connection acquire(Duration timeout) {
        RetryTemplate template = buildRetryTemplate(timeout);
        AtomicInteger attempts = new AtomicInteger();
        try {
            return template.execute((RetryContext ctx) -> {
                int attempt = attempts.incrementAndGet();
                if (attempt > 1) {
                    log.warn("Retrying connection acquisition (attempt {}): {}", attempt,
                            ctx.getLastThrowable() == null ? ""
                                    : ctx.getLastThrowable().getMessage());
                }
                return dataSource.getConnection();
            });
        } catch (SQLException e) {
            if (classifier.isTransient(e)) {
                log.error("Connection acquisition exhausted after {} attempt(s)", attempts.get());
                throw new PoolExhaustedException(attempts.get(), e);
            }
            throw new WarehouseConnectionException(
                    "Non-transient connection failure: " + e.getMessage(), e);
        } catch (WarehouseWriteException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new WarehouseConnectionException("Connection acquisition failed: "
                    + e.getMessage(), e);
        }
    }

    /**
     * Returns a connection to the pool. Failures are logged, never raised.
     *
     * @param connection connection obtained from {@link #acquire()}; {@code null} is ignored
     */
    public void release(Connection connection) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to return connection to pool: {}", e.getMessage(), e);
        }
    }

    /**
     * Runs a trivial round-trip query.
     *
     * @return {@code true} if the database answered
     */
    public boolean healthCheck() {
        try {
            runHealthQuery();
            return true;
        } catch (SQLException | WarehouseWriteException e) {
            log.warn("Health check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Closes the underlying pool and all live connections.
     */
    @Override
    public void close() {
        if (dataSource instanceof AutoCloseable) {
            try {
                ((AutoCloseable) dataSource).close();
                log.info("Connection pool closed");
            } catch (Exception e) {
                log.warn("Failed to close connection pool: {}", e.getMessage(), e);
            }
        }
    }

    private void runHealthQuery() throws SQLException {
        Connection connection = acquire();
        try (Statement st = connection.createStatement()) {
            st.execute(HEALTH_CHECK_SQL);
        } finally {
            release(connection);
        }
    }

    private RetryTemplate buildRetryTemplate(Duration timeout) {
        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new TransientRetryPolicy(pool.getMaxRetries() + 1, classifier,
                deadlineNanos(timeout), pool));
        ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
        backOff.setInitialInterval(pool.getInitialBackoff().toMillis());
        backOff.setMultiplier(pool.getBackoffMultiplier());
        backOff.setMaxInterval(pool.getMaxBackoff().toMillis());
        backOff.setSleeper(sleeper);
        template.setBackOffPolicy(backOff);
        return template;
    }

    /**
     * Converts a caller timeout into an absolute {@link System#nanoTime()} deadline.
     *
     * @param timeout caller timeout, or {@code null} for none
     * @return deadline; {@link Long#MAX_VALUE} means no deadline
     */
    static long deadlineNanos(Duration timeout) {
        if (timeout == null || timeout.compareTo(UNBOUNDED_TIMEOUT) >= 0) {
            return Long.MAX_VALUE;
        }
        return LongMath.saturatedAdd(System.nanoTime(), timeout.toNanos());
    }

    /**
     * Retries only transient failures, and only while the next backoff still ends before the
     * caller deadline.
     */
    static final class TransientRetryPolicy extends SimpleRetryPolicy {

        private static final long serialVersionUID = 1L;
        private static final String WITHIN_DEADLINE = "factlink.retry.withinDeadline";

        private final transient TransientErrorClassifier classifier;
        private final long deadlineNanos;
        private final long initialBackoffMillis;
        private final double multiplier;
        private final long maxBackoffMillis;

        TransientRetryPolicy(int maxAttempts, TransientErrorClassifier classifier,
                long deadlineNanos, WarehouseProperties.Pool pool) {
            super(maxAttempts);
            this.classifier = classifier;
            this.deadlineNanos = deadlineNanos;
            this.initialBackoffMillis = pool.getInitialBackoff().toMillis();
            this.multiplier = pool.getBackoffMultiplier();
            this.maxBackoffMillis = pool.getMaxBackoff().toMillis();
        }

        @Override
        public void registerThrowable(RetryContext context, Throwable throwable) {
            super.registerThrowable(context, throwable);
            // Decided once per failure; canRetry is asked again after the backoff.
            context.setAttribute(WITHIN_DEADLINE, nextBackoffEndsBeforeDeadline(context));
        }

        @Override
        public boolean canRetry(RetryContext context) {
            Throwable last = context.getLastThrowable();
            if (last == null) {
                return super.canRetry(context);
            }
            return classifier.isTransient(last)
                    && Boolean.TRUE.equals(context.getAttribute(WITHIN_DEADLINE))
                    && super.canRetry(context);
        }

        private boolean nextBackoffEndsBeforeDeadline(RetryContext context) {
            if (deadlineNanos == Long.MAX_VALUE) {
                return true;
            }
            long backoffNanos = TimeUnit.MILLISECONDS.toNanos(nextBackoffMillis(context));
            return LongMath.saturatedAdd(System.nanoTime(), backoffNanos) < deadlineNanos;
        }

        /**
         * Mirrors {@link ExponentialBackOffPolicy}: the n-th sleep is
         * {@code initial * multiplier^(n-1)} capped at the maximum.
         */
        private long nextBackoffMillis(RetryContext context) {
            double backoff = initialBackoffMillis
                    * Math.pow(multiplier, Math.max(0, context.getRetryCount() - 1));
            return (long) Math.min(backoff, maxBackoffMillis);
        }
    }
}
