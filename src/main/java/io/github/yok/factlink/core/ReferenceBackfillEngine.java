package io.github.yok.factlink.core;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import io.github.yok.factlink.config.FactTableEntry;
import io.github.yok.factlink.config.ForeignKeyConfigValidator;
import io.github.yok.factlink.config.ForeignKeyEntry;
import io.github.yok.factlink.db.ColumnProjection;
import io.github.yok.factlink.db.ConnectionPoolManager;
import io.github.yok.factlink.db.SchemaIntrospector;
import io.github.yok.factlink.error.ConfigurationException;
import io.github.yok.factlink.error.DataWriteException;
import io.github.yok.factlink.error.ErrorCategory;
import io.github.yok.factlink.error.SchemaDriftException;
import io.github.yok.factlink.error.WarehouseWriteException;
import io.github.yok.factlink.sql.ConflictPolicy;
import io.github.yok.factlink.sql.SqlStatementBuilder;
import io.github.yok.factlink.sql.SqlTemplate;
import io.github.yok.factlink.sql.TableRef;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

/**
 * Inserts the reference rows a fact batch depends on, so that the fact load never violates a
 * foreign key.
 *
 * <h2>Processing</h2>
 *
 * <ol>
 * <li>Entries run in declared order. An entry whose {@code depends-on} entry failed or was skipped
 * is skipped.</li>
 * <li>Candidates are derived from the batch ({@link CandidateDeriver}).</li>
 * <li>Candidate rows are stamped with tracking columns, projected onto the reference table and
 * written with its conflict policy, in chunks, inside one transaction per entry.</li>
 * <li>A failure rolls back only that entry. It fails the whole backfill unless the entry is
 * optional.</li>
 * </ol>
 *
 * <p>
 * Backfill is idempotent: a second run over the same batch inserts nothing.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ReferenceBackfillEngine {

    private final String domain;
    private final FactTableEntry factTable;
    private final List<ForeignKeyEntry> entries;
    private final ConnectionPoolManager pool;
    private final SchemaIntrospector introspector;
    private final CandidateDeriver deriver;
    private final int batchSize;
    private final Clock clock;

    // Replaceable in tests to inject statement failures
    @Getter(AccessLevel.PACKAGE)
    @Setter(AccessLevel.PACKAGE)
    private StatementExecutor statementExecutor;

    /**
     * Creates the engine.
     *
     * @param domain domain name
     * @param factTable fact table and its foreign keys
     * @param pool connection pool
     * @param introspector schema introspector shared with the loader
     * @param batchSize maximum rows per statement
     * @throws ConfigurationException if the foreign key configuration is invalid
     */
    public ReferenceBackfillEngine(String domain, FactTableEntry factTable,
            ConnectionPoolManager pool, SchemaIntrospector introspector, int batchSize) {
        this(domain, factTable, pool, introspector, batchSize, Clock.systemUTC(),
                StatementExecutor.jdbc());
    }

    ReferenceBackfillEngine(String domain, FactTableEntry factTable, ConnectionPoolManager pool,
            SchemaIntrospector introspector, int batchSize, Clock clock,
            StatementExecutor statementExecutor) {
        ForeignKeyConfigValidator.validate(domain, factTable);
        if (batchSize < 1) {
            throw new ConfigurationException("batch-size must be positive: " + batchSize);
        }
        this.domain = domain;
        this.factTable = factTable;
        this.entries = ImmutableList.copyOf(factTable.getForeignKeys());
        this.pool = pool;
        this.introspector = introspector;
        this.deriver = new CandidateDeriver();
        this.batchSize = batchSize;
        this.clock = clock;
        this.statementExecutor = statementExecutor;
    }

    /**
     * Backfills every reference table of the batch.
     *
     * @param batch fact batch
     * @return per-entry outcome; a successful result opens the load gate for this batch
     * @throws ConfigurationException if the batch belongs to another fact table
     */
    public BackfillResult backfill(FactBatch batch) {
        return run(batch, false);
    }

    /**
     * Computes what {@link #backfill(FactBatch)} would do without writing anything.
     *
     * <p>
     * Candidates are derived and existing keys are looked up. {@code rowsInserted} is the number
     * of missing keys; {@code rowsUpdated} stays zero because fill decisions are made by the
     * database. The result never opens the load gate.
     * </p>
     *
     * @param batch fact batch
     * @return planned outcome
     */
    public BackfillResult plan(FactBatch batch) {
        return run(batch, true);
    }

    private BackfillResult run(FactBatch batch, boolean planOnly) {
        checkBatch(batch);
        long start = System.nanoTime();
        String mode = planOnly ? "Plan" : "Backfill";
        log.info("[{}] {} started: batch={}, rows={}, entries={}", domain, mode,
                batch.getBatchId(), batch.size(), entries.size());

        Set<String> unavailable = new HashSet<>();
        List<TableBackfillResult> results = new ArrayList<>(entries.size());
        for (ForeignKeyEntry entry : entries) {
            String blockedBy = entry.getDependsOn().stream().filter(unavailable::contains)
                    .findFirst().orElse(null);
            if (blockedBy != null) {
                log.warn("[{}] Skipped: dependency {} did not succeed", entry.getName(),
                        blockedBy);
                unavailable.add(entry.getName());
                results.add(skipped(entry, blockedBy));
                continue;
            }
            TableBackfillResult result = processEntry(batch, entry, planOnly);
            if (result.getStatus() != BackfillStatus.SUCCEEDED) {
                unavailable.add(entry.getName());
            }
            results.add(result);
        }

        BackfillResult result = new BackfillResult(batch, planOnly, results,
                Duration.ofNanos(System.nanoTime() - start));
        if (result.isSuccess()) {
            log.info("[{}] {} completed: inserted={}, updated={}, elapsed={}ms", domain, mode,
                    result.getTotalInserted(), result.getTotalUpdated(),
                    result.getDuration().toMillis());
        } else {
            log.error("[{}] {} failed: errors={}", domain, mode, result.getErrors());
        }
        return result;
    }

    private void checkBatch(FactBatch batch) {
        if (!domain.equals(batch.getDomain())
                || !factTable.getTableRef().equals(batch.getFactTable())) {
            throw new ConfigurationException("Batch for " + batch.getDomain() + "/"
                    + batch.getFactTable() + " cannot be backfilled by the engine for " + domain
                    + "/" + factTable.getTableRef());
        }
    }

    private TableBackfillResult processEntry(FactBatch batch, ForeignKeyEntry entry,
            boolean planOnly) {
        TableRef target = entry.getTargetTableRef();
        String operation = "backfill." + entry.getConflictPolicy().name().toLowerCase(Locale.ROOT);
        try {
            List<BackfillCandidate> candidates = deriver.derive(batch.getRecords(), entry);
            if (candidates.isEmpty()) {
                return new TableBackfillResult(entry.getName(), target, entry.getConflictPolicy(),
                        entry.isOptional(), BackfillStatus.SUCCEEDED, 0, 0, 0, 0, null);
            }
            return planOnly ? planEntry(entry, candidates) : writeEntry(entry, candidates);
        } catch (WarehouseWriteException e) {
            if (entry.isOptional()) {
                log.warn("[{}] Optional entry failed: {}", entry.getName(), e.getMessage());
            } else {
                log.error("[{}] Entry failed: {}", entry.getName(), e.getMessage(), e);
            }
            return new TableBackfillResult(entry.getName(), target, entry.getConflictPolicy(),
                    entry.isOptional(), BackfillStatus.FAILED, 0, 0, 0, 0,
                    ErrorDetail.from(operation, target, e));
        }
    }

    private TableBackfillResult planEntry(ForeignKeyEntry entry,
            List<BackfillCandidate> candidates) {
        TableRef target = entry.getTargetTableRef();
        requireKeyColumns(entry);
        Connection conn = pool.acquire();
        try {
            Set<List<String>> existing = findExisting(conn, entry, candidates);
            int missing = (int) candidates.stream()
                    .filter(c -> !existing.contains(KeyValues.canonical(c.getKey()))).count();
            log.info("[{}] Plan: candidates={}, existing={}, to insert={}", entry.getName(),
                    candidates.size(), existing.size(), missing);
            return new TableBackfillResult(entry.getName(), target, entry.getConflictPolicy(),
                    entry.isOptional(), BackfillStatus.SUCCEEDED, candidates.size(),
                    existing.size(), missing, 0, null);
        } catch (SQLException e) {
            throw new DataWriteException("backfill.plan", target.toString(), -1, e);
        } finally {
            pool.release(conn);
        }
    }

    private TableBackfillResult writeEntry(ForeignKeyEntry entry,
            List<BackfillCandidate> candidates) {
        TableRef target = entry.getTargetTableRef();
        Set<String> allowed = requireKeyColumns(entry);

        Map<String, Object> tracking = entry.isTrackingFieldsEnabled()
                ? TrackingFields.values(domain, clock, allowed)
                : Map.of();
        if (entry.isTrackingFieldsEnabled() && tracking.isEmpty()) {
            log.debug("[{}] {} has no tracking columns", entry.getName(), target);
        }
        List<Map<String, Object>> rows = new ArrayList<>(candidates.size());
        for (BackfillCandidate candidate : candidates) {
            Map<String, Object> row = new LinkedHashMap<>(candidate.getValues());
            row.putAll(tracking);
            rows.add(row);
        }
        ColumnProjection projection =
                introspector.projectColumns(rows, target.getSchema(), target.getTable());
        List<String> columns = projection.getColumns();
        int rowsPerStatement =
                Math.min(batchSize, SqlStatementBuilder.maxRowsPerStatement(columns.size()));

        String operation = "backfill." + entry.getConflictPolicy().name().toLowerCase(Locale.ROOT);
        int chunkIndex = -1;
        int inserted = 0;
        int updated = 0;
        int existingCount;
        Connection conn = pool.acquire();
        try {
            conn.setAutoCommit(false);
            Set<List<String>> existing = findExisting(conn, entry, candidates);
            existingCount = existing.size();

            List<Map<String, Object>> toWrite = new ArrayList<>(rows.size());
            for (int i = 0; i < candidates.size(); i++) {
                boolean exists = existing.contains(KeyValues.canonical(candidates.get(i).getKey()));
                if (!exists || entry.getConflictPolicy() == ConflictPolicy.FILL_NULL_ONLY) {
                    toWrite.add(projection.getRecords().get(i));
                }
            }

            for (List<Map<String, Object>> chunk : Lists.partition(toWrite, rowsPerStatement)) {
                chunkIndex++;
                SqlTemplate template = SqlStatementBuilder.buildInsertWithConflict(target, columns,
                        chunk.size(), entry.getTargetKeyColumns(), entry.getConflictPolicy(),
                        TrackingFields.NAMES);
                for (Boolean flag : statementExecutor.executeReturning(conn, template, chunk)) {
                    if (Boolean.TRUE.equals(flag)) {
                        inserted++;
                    } else {
                        updated++;
                    }
                }
            }
            conn.commit();
        } catch (SQLException e) {
            rollback(conn, entry.getName(), e);
            throw new DataWriteException(operation, target.toString(), chunkIndex, e);
        } catch (RuntimeException e) {
            rollback(conn, entry.getName(), e);
            throw e;
        } finally {
            restoreAutoCommit(conn);
            pool.release(conn);
        }

        log.info("[{}] {}: candidates={}, existing={}, inserted={}, updated={}", entry.getName(),
                target, candidates.size(), existingCount, inserted, updated);
        return new TableBackfillResult(entry.getName(), target, entry.getConflictPolicy(),
                entry.isOptional(), BackfillStatus.SUCCEEDED, candidates.size(), existingCount,
                inserted, updated, null);
    }

    private Set<String> requireKeyColumns(ForeignKeyEntry entry) {
        TableRef target = entry.getTargetTableRef();
        Set<String> allowed = introspector.getAllowedColumns(target.getSchema(), target.getTable());
        for (String key : entry.getTargetKeyColumns()) {
            if (!allowed.contains(key)) {
                throw new SchemaDriftException(
                        "Key column " + key + " does not exist in " + target);
            }
        }
        return allowed;
    }

    private Set<List<String>> findExisting(Connection conn, ForeignKeyEntry entry,
            List<BackfillCandidate> candidates) throws SQLException {
        List<String> keyColumns = entry.getTargetKeyColumns();
        int tuplesPerQuery =
                Math.min(batchSize, SqlStatementBuilder.maxRowsPerStatement(keyColumns.size()));
        Set<List<String>> existing = new HashSet<>();
        for (List<BackfillCandidate> chunk : Lists.partition(candidates, tuplesPerQuery)) {
            SqlTemplate template = SqlStatementBuilder.buildSelectExisting(
                    entry.getTargetTableRef(), keyColumns, chunk.size());
            List<Object> values = new ArrayList<>(template.getParameterCount());
            for (BackfillCandidate candidate : chunk) {
                values.addAll(candidate.getKey());
            }
            for (List<Object> row : statementExecutor.query(conn, template, values)) {
                existing.add(KeyValues.canonical(row));
            }
        }
        return existing;
    }

    private static void rollback(Connection conn, String name, Exception cause) {
        try {
            conn.rollback();
            log.warn("[{}] Transaction rolled back", name);
        } catch (SQLException rollbackError) {
            log.warn("[{}] Rollback failed: {}", name, rollbackError.getMessage());
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

    private static TableBackfillResult skipped(ForeignKeyEntry entry, String dependency) {
        TableRef target = entry.getTargetTableRef();
        ErrorDetail error = new ErrorDetail(ErrorCategory.DATA,
                "backfill.skip", target.getSchema(), target.getTable(), null, null,
                "Dependency " + dependency + " did not succeed");
        return new TableBackfillResult(entry.getName(), target, entry.getConflictPolicy(),
                entry.isOptional(), BackfillStatus.SKIPPED, 0, 0, 0, 0, error);
    }
}
