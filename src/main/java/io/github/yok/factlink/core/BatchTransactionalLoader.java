package io.github.yok.factlink.core;

import com.google.common.collect.Lists;
import io.github.yok.factlink.db.ColumnProjection;
import io.github.yok.factlink.db.ConnectionPoolManager;
import io.github.yok.factlink.db.SchemaIntrospector;
import io.github.yok.factlink.error.ConfigurationException;
import io.github.yok.factlink.error.DataWriteException;
import io.github.yok.factlink.error.GateViolationException;
import io.github.yok.factlink.error.WarehouseWriteException;
import io.github.yok.factlink.sql.ConflictPolicy;
import io.github.yok.factlink.sql.SqlStatementBuilder;
import io.github.yok.factlink.sql.SqlTemplate;
import io.github.yok.factlink.sql.TableRef;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes a fact batch in one transaction: either every row lands or none does.
 *
 * <h2>Gate</h2>
 *
 * <p>
 * A load needs the {@link BackfillResult} of the same batch. The result must come from
 * {@link ReferenceBackfillEngine#backfill(FactBatch)} (not {@code plan}) and be successful;
 * anything else raises {@link GateViolationException} before a connection is taken.
 * </p>
 *
 * <h2>Processing</h2>
 *
 * <ol>
 * <li>Records are projected onto the columns of the fact table.</li>
 * <li>In {@link LoadMode#REFRESH}, rows matching each distinct key combination are deleted.</li>
 * <li>Rows are written in chunks of {@code batch-size}; each chunk is further split so that no
 * statement exceeds the bind parameter limit.</li>
 * <li>Commit. Any failure rolls back everything and is reported with the failing chunk index.</li>
 * </ol>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class BatchTransactionalLoader {

    private final ConnectionPoolManager pool;
    private final SchemaIntrospector introspector;
    private final int batchSize;

    // Replaceable in tests to inject statement failures
    @Getter(AccessLevel.PACKAGE)
    @Setter(AccessLevel.PACKAGE)
    private StatementExecutor statementExecutor;

    /**
     * Creates the loader.
     *
     * @param pool connection pool
     * @param introspector schema introspector shared with the backfill engine
     * @param batchSize rows per chunk
     */
    public BatchTransactionalLoader(ConnectionPoolManager pool, SchemaIntrospector introspector,
            int batchSize) {
        this(pool, introspector, batchSize, StatementExecutor.jdbc());
    }

    BatchTransactionalLoader(ConnectionPoolManager pool, SchemaIntrospector introspector,
            int batchSize, StatementExecutor statementExecutor) {
        if (batchSize < 1) {
            throw new ConfigurationException("batch-size must be positive: " + batchSize);
        }
        this.pool = pool;
        this.introspector = introspector;
        this.batchSize = batchSize;
        this.statementExecutor = statementExecutor;
    }

    /**
     * Loads the batch, reporting write failures in the result.
     *
     * @param backfill backfill result of this batch
     * @param batch fact batch
     * @param options load options
     * @return result; {@code success=false} after a rollback
     * @throws GateViolationException if the gate is closed
     * @throws ConfigurationException if the options do not fit the table
     */
    public LoadResult load(BackfillResult backfill, FactBatch batch, LoadOptions options) {
        checkGate(backfill, batch);
        String executionId = newExecutionId();
        long start = System.nanoTime();
        try {
            return write(batch, options, executionId, start);
        } catch (GateViolationException | ConfigurationException e) {
            throw e;
        } catch (WarehouseWriteException e) {
            return LoadResult.failure(elapsed(start), executionId,
                    ErrorDetail.from(operation(options.getMode()), batch.getFactTable(), e));
        }
    }

    /**
     * Loads the batch, throwing on failure.
     *
     * @param backfill backfill result of this batch
     * @param batch fact batch
     * @param options load options
     * @return successful result
     * @throws GateViolationException if the gate is closed
     * @throws WarehouseWriteException on any failure; nothing has been written
     */
    public LoadResult loadOrThrow(BackfillResult backfill, FactBatch batch, LoadOptions options) {
        checkGate(backfill, batch);
        return write(batch, options, newExecutionId(), System.nanoTime());
    }

    private static void checkGate(BackfillResult backfill, FactBatch batch) {
        if (batch == null) {
            throw new GateViolationException("No fact batch given");
        }
        if (backfill == null) {
            throw new GateViolationException(
                    "Backfill has not been run for batch " + batch.getBatchId());
        }
        if (backfill.isPlanOnly()) {
            throw new GateViolationException(
                    "A backfill plan cannot authorize a load; run backfill for batch "
                            + batch.getBatchId());
        }
        if (!backfill.covers(batch)) {
            throw new GateViolationException("Backfill result belongs to batch "
                    + backfill.getBatchId() + ", not " + batch.getBatchId());
        }
        if (!backfill.isSuccess()) {
            throw new GateViolationException("Backfill failed for batch " + batch.getBatchId()
                    + ": " + backfill.getErrors());
        }
    }

    private LoadResult write(FactBatch batch, LoadOptions options, String executionId,
            long start) {
        TableRef table = batch.getFactTable();
        LoadMode mode = options.getMode();
        if (batch.isEmpty()) {
            log.info("[{}] Load skipped: empty batch {}", table, batch.getBatchId());
            return LoadResult.success(0, 0, 0, elapsed(start), executionId,
                    Collections.emptyList());
        }
        log.info("[{}] Load started: execution={}, mode={}, rows={}", table, executionId, mode,
                batch.size());

        ColumnProjection projection =
                introspector.projectColumns(batch.getRecords(), table.getSchema(), table.getTable());
        List<String> columns = projection.getColumns();
        List<String> keys = options.getConflictKeys();
        checkKeys(mode, keys, columns, table);
        int rowsPerStatement =
                Math.min(batchSize, SqlStatementBuilder.maxRowsPerStatement(columns.size()));

        String operation = operation(mode);
        int chunkIndex = -1;
        int inserted = 0;
        int updated = 0;
        int deleted = 0;
        Connection conn = pool.acquire(options.getAcquireTimeout());
        try {
            conn.setAutoCommit(false);
            if (mode == LoadMode.REFRESH) {
                operation = "load.refresh.delete";
                deleted = statementExecutor.executeBatch(conn,
                        SqlStatementBuilder.buildDeleteByKeys(table, keys),
                        distinctKeys(projection.getRecords(), keys));
                log.info("[{}] Refresh deleted {} row(s)", table, deleted);
                operation = operation(mode);
            }
            for (List<Map<String, Object>> chunk : Lists.partition(projection.getRecords(),
                    batchSize)) {
                chunkIndex++;
                for (List<Map<String, Object>> rows : Lists.partition(chunk, rowsPerStatement)) {
                    SqlTemplate template = template(mode, table, columns, rows.size(), keys);
                    for (Boolean flag : statementExecutor.executeReturning(conn, template, rows)) {
                        if (Boolean.TRUE.equals(flag)) {
                            inserted++;
                        } else {
                            updated++;
                        }
                    }
                }
                log.debug("[{}] Chunk {} written", table, chunkIndex);
            }
            conn.commit();
        } catch (SQLException e) {
            rollback(conn, table, e);
            throw new DataWriteException(operation, table.toString(), chunkIndex, e);
        } catch (RuntimeException e) {
            rollback(conn, table, e);
            throw e;
        } finally {
            restoreAutoCommit(conn);
            pool.release(conn);
        }

        Duration duration = elapsed(start);
        log.info("[{}] Load completed: execution={}, inserted={}, updated={}, deleted={}, "
                + "elapsed={}ms", table, executionId, inserted, updated, deleted,
                duration.toMillis());
        return LoadResult.success(inserted, updated, deleted, duration, executionId,
                projection.getRemovedColumns());
    }

    private static void checkKeys(LoadMode mode, List<String> keys, List<String> columns,
            TableRef table) {
        if (!mode.requiresKeys()) {
            return;
        }
        if (keys.isEmpty()) {
            throw new ConfigurationException("Load mode " + mode + " requires conflict keys");
        }
        for (String key : keys) {
            if (!columns.contains(key)) {
                throw new ConfigurationException(
                        "Conflict key " + key + " is not a loaded column of " + table);
            }
        }
    }

    private static SqlTemplate template(LoadMode mode, TableRef table, List<String> columns,
            int rowCount, List<String> keys) {
        switch (mode) {
            case UPSERT:
                return SqlStatementBuilder.buildUpsert(table, columns, rowCount, keys);
            case INSERT_MISSING:
                return SqlStatementBuilder.buildInsertWithConflict(table, columns, rowCount, keys,
                        ConflictPolicy.INSERT_MISSING, Collections.emptySet());
            case FILL_NULL_ONLY:
                return SqlStatementBuilder.buildInsertWithConflict(table, columns, rowCount, keys,
                        ConflictPolicy.FILL_NULL_ONLY, Collections.emptySet());
            case INSERT:
            case REFRESH:
            default:
                return SqlStatementBuilder.buildInsert(table, columns, rowCount);
        }
    }

    private static List<List<Object>> distinctKeys(List<Map<String, Object>> rows,
            List<String> keys) {
        Set<List<Object>> distinct = new LinkedHashSet<>();
        for (Map<String, Object> row : rows) {
            List<Object> tuple = new ArrayList<>(keys.size());
            for (String key : keys) {
                tuple.add(row.get(key));
            }
            distinct.add(tuple);
        }
        return new ArrayList<>(distinct);
    }

    private static String operation(LoadMode mode) {
        return "load." + mode.name().toLowerCase(Locale.ROOT);
    }

    private static String newExecutionId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    private static Duration elapsed(long start) {
        return Duration.ofNanos(System.nanoTime() - start);
    }

    private static void rollback(Connection conn, TableRef table, Exception cause) {
        try {
            conn.rollback();
            log.warn("[{}] Transaction rolled back", table);
        } catch (SQLException rollbackError) {
            log.warn("[{}] Rollback failed: {}", table, rollbackError.getMessage());
            cause.addSuppressed(rollbackError);
        }
    }

    private static void restoreAutoCommit(Connection conn) {
        try {
            conn.setAutoCommit(true);
        } catch (SQLException e) {
            log.warn("Failed to restore auto-commit: {}", e.getMessage());
        }
    }
}
