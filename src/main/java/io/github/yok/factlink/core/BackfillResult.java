package io.github.yok.factlink.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.factlink.sql.TableRef;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of backfilling the reference tables of one {@link FactBatch}.
 *
 * <p>
 * Only {@link ReferenceBackfillEngine} creates instances. A successful, non-plan result is the
 * token {@link BatchTransactionalLoader} requires before it writes the same batch.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class BackfillResult {

    private final String batchId;
    private final String domain;
    private final TableRef factTable;
    // True when every non-optional entry succeeded
    private final boolean success;
    // True when produced by plan(): nothing was written
    private final boolean planOnly;
    // Entry names in the order they were processed
    private final List<String> processingOrder;
    private final List<TableBackfillResult> entries;
    private final Duration duration;

    BackfillResult(FactBatch batch, boolean planOnly, List<TableBackfillResult> entries,
            Duration duration) {
        this.batchId = batch.getBatchId();
        this.domain = batch.getDomain();
        this.factTable = batch.getFactTable();
        this.planOnly = planOnly;
        this.entries = ImmutableList.copyOf(entries);
        this.processingOrder = entries.stream().map(TableBackfillResult::getName)
                .collect(ImmutableList.toImmutableList());
        this.success = entries.stream().noneMatch(TableBackfillResult::isBlocking);
        this.duration = duration;
    }

    /**
     * Looks up an entry by foreign key name.
     *
     * @param name entry name
     * @return entry result, if processed
     */
    public Optional<TableBackfillResult> findEntry(String name) {
        return entries.stream().filter(e -> e.getName().equals(name)).findFirst();
    }

    /**
     * Returns an entry by foreign key name.
     *
     * @param name entry name
     * @return entry result
     * @throws NoSuchElementException if no entry has that name
     */
    public TableBackfillResult entry(String name) {
        return findEntry(name)
                .orElseThrow(() -> new NoSuchElementException("No backfill entry: " + name));
    }

    /**
     * Returns counts summed per reference table, in processing order.
     *
     * @return totals keyed by table
     */
    public Map<TableRef, TableTotals> getTableTotals() {
        Map<TableRef, TableTotals> totals = new LinkedHashMap<>();
        for (TableBackfillResult e : entries) {
            totals.computeIfAbsent(e.getTargetTable(), t -> new TableTotals()).add(e);
        }
        return Collections.unmodifiableMap(totals);
    }

    /**
     * Returns the errors of every failed or skipped entry.
     *
     * @return error details
     */
    public List<ErrorDetail> getErrors() {
        return entries.stream().filter(e -> e.getError() != null).map(TableBackfillResult::getError)
                .collect(Collectors.toUnmodifiableList());
    }

    public int getTotalInserted() {
        return entries.stream().mapToInt(TableBackfillResult::getRowsInserted).sum();
    }

    public int getTotalUpdated() {
        return entries.stream().mapToInt(TableBackfillResult::getRowsUpdated).sum();
    }

    boolean covers(FactBatch batch) {
        return batchId.equals(batch.getBatchId()) && factTable.equals(batch.getFactTable());
    }
}
