package io.github.yok.factlink.core;

import io.github.yok.factlink.error.DataWriteException;
import io.github.yok.factlink.error.ErrorCategory;
import io.github.yok.factlink.error.WarehouseWriteException;
import io.github.yok.factlink.sql.TableRef;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * One failure reported in a {@link LoadResult} or {@link BackfillResult}.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@RequiredArgsConstructor
public final class ErrorDetail {

    private final ErrorCategory category;
    private final String operation;
    private final String schema;
    private final String table;
    // Zero-based chunk index, or null when not tied to a chunk
    private final Integer chunkIndex;
    private final String sqlState;
    private final String message;

    /**
     * Builds a detail from a write-path exception.
     *
     * @param operation operation name
     * @param table target table
     * @param error failure
     * @return detail
     */
    public static ErrorDetail from(String operation, TableRef table, WarehouseWriteException error) {
        Integer chunk = null;
        String sqlState = null;
        String op = operation;
        if (error instanceof DataWriteException) {
            DataWriteException dwe = (DataWriteException) error;
            chunk = dwe.getChunkIndex() >= 0 ? dwe.getChunkIndex() : null;
            sqlState = dwe.getSqlState();
            op = dwe.getOperation();
        }
        return new ErrorDetail(error.getCategory(), op, table.getSchema(), table.getTable(), chunk,
                sqlState, error.getMessage());
    }
}
