package io.github.yok.factlink.core;

import io.github.yok.factlink.sql.ConflictPolicy;
import io.github.yok.factlink.sql.TableRef;
import lombok.Getter;
import lombok.ToString;

/**
 * Counts for one foreign key entry.
 *
 * <p>
 * {@code rowsSkipped} counts candidates that were neither inserted nor updated: existing keys
 * under {@code insert_missing}, and existing rows without null columns to fill under
 * {@code fill_null_only}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class TableBackfillResult {

    private final String name;
    private final TableRef targetTable;
    private final ConflictPolicy conflictPolicy;
    private final boolean optional;
    private final BackfillStatus status;
    private final int candidates;
    private final int existing;
    private final int rowsInserted;
    private final int rowsUpdated;
    private final int rowsSkipped;
    // Failure or skip reason; null on success
    private final ErrorDetail error;

    TableBackfillResult(String name, TableRef targetTable, ConflictPolicy conflictPolicy,
            boolean optional, BackfillStatus status, int candidates, int existing,
            int rowsInserted, int rowsUpdated, ErrorDetail error) {
        this.name = name;
        this.targetTable = targetTable;
        this.conflictPolicy = conflictPolicy;
        this.optional = optional;
        this.status = status;
        this.candidates = candidates;
        this.existing = existing;
        this.rowsInserted = rowsInserted;
        this.rowsUpdated = rowsUpdated;
        this.rowsSkipped = Math.max(0, candidates - rowsInserted - rowsUpdated);
        this.error = error;
    }

    /**
     * Returns whether this entry blocks the load.
     *
     * @return {@code true} if the entry did not succeed and is not optional
     */
    public boolean isBlocking() {
        return status != BackfillStatus.SUCCEEDED && !optional;
    }
}
