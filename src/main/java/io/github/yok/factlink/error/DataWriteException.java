package io.github.yok.factlink.error;

import java.sql.SQLException;
import lombok.Getter;

/**
 * A statement failed while rows were being written. The enclosing transaction has been rolled
 * back by the time this exception is raised.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class DataWriteException extends WarehouseWriteException {

    private static final long serialVersionUID = 1L;

    // Operation name (e.g. "load.insert", "backfill.insert_missing")
    private final String operation;
    // Schema-qualified target table, unquoted
    private final String table;
    // Zero-based chunk index, or -1 when the failure is not tied to a chunk
    private final int chunkIndex;

    /**
     * Creates the exception.
     *
     * @param operation operation name
     * @param table schema-qualified table name
     * @param chunkIndex zero-based chunk index, or {@code -1}
     * @param cause original driver error
     */
    public DataWriteException(String operation, String table, int chunkIndex, Throwable cause) {
        super(ErrorCategory.DATA, buildMessage(operation, table, chunkIndex, cause), cause);
        this.operation = operation;
        this.table = table;
        this.chunkIndex = chunkIndex;
    }

    /**
     * Returns the SQLState of the first {@link SQLException} in the cause chain.
     *
     * @return SQLState, or {@code null} when unavailable
     */
    public String getSqlState() {
        Throwable t = getCause();
        while (t != null) {
            if (t instanceof SQLException) {
                return ((SQLException) t).getSQLState();
            }
            t = t.getCause();
        }
        return null;
    }

    private static String buildMessage(String operation, String table, int chunkIndex,
            Throwable cause) {
        StringBuilder sb = new StringBuilder();
        sb.append(operation).append(" failed for ").append(table);
        if (chunkIndex >= 0) {
            sb.append(" at chunk ").append(chunkIndex);
        }
        if (cause != null) {
            sb.append(": ").append(cause.getMessage());
        }
        return sb.toString();
    }
}
