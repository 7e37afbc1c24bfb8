package io.github.yok.factlink.core;

import io.github.yok.factlink.sql.SqlTemplate;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs prepared write-path statements. Tests replace it to inject failures per chunk.
 *
 * @author Yasuharu.Okawauchi
 */
interface StatementExecutor {

    /**
     * Executes a multi-row insert ending in {@code RETURNING <boolean>}.
     *
     * @param connection connection inside the caller's transaction
     * @param template statement template
     * @param rows rows to bind
     * @return one flag per written row: {@code true} inserted, {@code false} updated
     * @throws SQLException execution failure
     */
    List<Boolean> executeReturning(Connection connection, SqlTemplate template,
            List<? extends Map<String, ?>> rows) throws SQLException;

    /**
     * Executes a query whose parameters are the flattened values.
     *
     * @param connection connection
     * @param template statement template
     * @param values bind values
     * @return result rows as lists of column values
     * @throws SQLException execution failure
     */
    List<List<Object>> query(Connection connection, SqlTemplate template, List<?> values)
            throws SQLException;

    /**
     * Executes a single-tuple statement once per tuple as a JDBC batch.
     *
     * @param connection connection inside the caller's transaction
     * @param template statement template covering one tuple
     * @param tuples bind tuples
     * @return total affected rows
     * @throws SQLException execution failure
     */
    int executeBatch(Connection connection, SqlTemplate template, List<? extends List<?>> tuples)
            throws SQLException;

    /**
     * Returns the JDBC implementation.
     *
     * @return executor
     */
    static StatementExecutor jdbc() {
        return new StatementExecutor() {

            @Override
            public List<Boolean> executeReturning(Connection connection, SqlTemplate template,
                    List<? extends Map<String, ?>> rows) throws SQLException {
                List<Boolean> flags = new ArrayList<>(rows.size());
                try (PreparedStatement ps = connection.prepareStatement(template.getSql())) {
                    template.bindRows(ps, rows);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            flags.add(rs.getBoolean(1));
                        }
                    }
                }
                return flags;
            }

            @Override
            public List<List<Object>> query(Connection connection, SqlTemplate template,
                    List<?> values) throws SQLException {
                List<List<Object>> result = new ArrayList<>();
                try (PreparedStatement ps = connection.prepareStatement(template.getSql())) {
                    template.bindValues(ps, values);
                    try (ResultSet rs = ps.executeQuery()) {
                        int width = rs.getMetaData().getColumnCount();
                        while (rs.next()) {
                            List<Object> row = new ArrayList<>(width);
                            for (int i = 1; i <= width; i++) {
                                row.add(rs.getObject(i));
                            }
                            result.add(row);
                        }
                    }
                }
                return result;
            }

            @Override
            public int executeBatch(Connection connection, SqlTemplate template,
                    List<? extends List<?>> tuples) throws SQLException {
                if (tuples.isEmpty()) {
                    return 0;
                }
                int affected = 0;
                try (PreparedStatement ps = connection.prepareStatement(template.getSql())) {
                    for (List<?> tuple : tuples) {
                        template.bindValues(ps, tuple);
                        ps.addBatch();
                    }
                    for (int count : ps.executeBatch()) {
                        if (count > 0) {
                            affected += count;
                        }
                    }
                }
                return affected;
            }
        };
    }
}
