package io.github.yok.factlink.sql;

import com.google.common.collect.ImmutableList;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * A parameterized statement together with the column order its placeholders expect.
 *
 * <p>
 * Values only ever reach the database through {@link #bindRows(PreparedStatement, List)} or
 * {@link #bindValues(PreparedStatement, List)}; the SQL text contains quoted identifiers,
 * keywords and {@code ?} placeholders only.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public final class SqlTemplate {

    // SQL text with ? placeholders
    private final String sql;
    // Column names in placeholder order for one row (or key tuple)
    private final List<String> columns;
    // Number of rows (or key tuples) the placeholders cover
    private final int rowCount;

    SqlTemplate(String sql, List<String> columns, int rowCount) {
        this.sql = sql;
        this.columns = ImmutableList.copyOf(columns);
        this.rowCount = rowCount;
    }

    /**
     * Returns the number of bind parameters in the statement.
     *
     * @return parameter count
     */
    public int getParameterCount() {
        return columns.size() * rowCount;
    }

    /**
     * Binds row maps in row-major order. Missing keys are bound as {@code NULL}.
     *
     * @param ps prepared statement created from {@link #getSql()}
     * @param rows rows to bind; size must equal {@link #getRowCount()}
     * @throws SQLException if binding fails
     */
    public void bindRows(PreparedStatement ps, List<? extends Map<String, ?>> rows)
            throws SQLException {
        if (rows.size() != rowCount) {
            throw new IllegalArgumentException(
                    "Template expects " + rowCount + " row(s) but got " + rows.size());
        }
        int index = 1;
        for (Map<String, ?> row : rows) {
            for (String column : columns) {
                bind(ps, index++, row.get(column));
            }
        }
    }

    /**
     * Binds a flat list of values in placeholder order.
     *
     * @param ps prepared statement created from {@link #getSql()}
     * @param values values; size must equal {@link #getParameterCount()}
     * @throws SQLException if binding fails
     */
    public void bindValues(PreparedStatement ps, List<?> values) throws SQLException {
        if (values.size() != getParameterCount()) {
            throw new IllegalArgumentException("Template expects " + getParameterCount()
                    + " parameter(s) but got " + values.size());
        }
        int index = 1;
        for (Object value : values) {
            bind(ps, index++, value);
        }
    }

    private static void bind(PreparedStatement ps, int index, Object value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.NULL);
        } else {
            ps.setObject(index, value);
        }
    }

    @Override
    public String toString() {
        return sql;
    }
}
