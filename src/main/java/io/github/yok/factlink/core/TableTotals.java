package io.github.yok.factlink.core;

import lombok.Getter;
import lombok.ToString;

/**
 * Counts of one reference table summed over every entry that targets it.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class TableTotals {

    private int rowsInserted;
    private int rowsUpdated;
    private int rowsSkipped;

    void add(TableBackfillResult entry) {
        rowsInserted += entry.getRowsInserted();
        rowsUpdated += entry.getRowsUpdated();
        rowsSkipped += entry.getRowsSkipped();
    }
}
