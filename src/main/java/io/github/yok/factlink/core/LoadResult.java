package io.github.yok.factlink.core;

import com.google.common.collect.ImmutableList;
import java.time.Duration;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one loader call. Immutable; returned to the caller for audit logging.
 *
 * <p>
 * On failure nothing was written: the whole call was rolled back.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class LoadResult {

    private final boolean success;
    private final int rowsInserted;
    private final int rowsUpdated;
    // Rows removed by REFRESH mode before inserting
    private final int rowsDeleted;
    private final Duration duration;
    private final String executionId;
    private final List<ErrorDetail> errors;
    // Columns dropped by projection
    private final List<String> removedColumns;

    private LoadResult(boolean success, int rowsInserted, int rowsUpdated, int rowsDeleted,
            Duration duration, String executionId, List<ErrorDetail> errors,
            List<String> removedColumns) {
        this.success = success;
        this.rowsInserted = rowsInserted;
        this.rowsUpdated = rowsUpdated;
        this.rowsDeleted = rowsDeleted;
        this.duration = duration;
        this.executionId = executionId;
        this.errors = ImmutableList.copyOf(errors);
        this.removedColumns = ImmutableList.copyOf(removedColumns);
    }

    static LoadResult success(int rowsInserted, int rowsUpdated, int rowsDeleted,
            Duration duration, String executionId, List<String> removedColumns) {
        return new LoadResult(true, rowsInserted, rowsUpdated, rowsDeleted, duration, executionId,
                ImmutableList.of(), removedColumns);
    }

    static LoadResult failure(Duration duration, String executionId, ErrorDetail error) {
        return new LoadResult(false, 0, 0, 0, duration, executionId, ImmutableList.of(error),
                ImmutableList.of());
    }
}
