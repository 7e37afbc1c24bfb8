package io.github.yok.factlink.sql;

import io.github.yok.factlink.error.InvalidIdentifierException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;

/**
 * Builds parameterized PostgreSQL statements for the write path.
 *
 * <h2>Safety rules</h2>
 *
 * <ul>
 * <li>Every identifier passes through {@link #quoteIdentifier(String)}.</li>
 * <li>Every value is a {@code ?} placeholder bound by {@link SqlTemplate}; no method of this class
 * accepts row values.</li>
 * <li>Tables are always schema-qualified via {@link #qualify(TableRef)}.</li>
 * </ul>
 *
 * <h2>Batching</h2>
 *
 * <p>
 * Insert statements cover a whole chunk with one multi-row {@code VALUES} list so that a chunk is a
 * single round trip. {@link #maxRowsPerStatement(int)} gives the largest row count that stays
 * within the PostgreSQL bind-parameter ceiling.
 * </p>
 *
 * <p>
 * All insert statements end in a {@code RETURNING} clause yielding one boolean per affected row:
 * {@code true} for an inserted row and {@code false} for an updated row.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class SqlStatementBuilder {

    /**
     * Maximum identifier length in bytes (PostgreSQL {@code NAMEDATALEN - 1}).
     */
    public static final int MAX_IDENTIFIER_BYTES = 63;

    /**
     * Maximum number of bind parameters in one PostgreSQL statement.
     */
    public static final int MAX_BIND_PARAMETERS = 65535;

    // Alias of the target table inside ON CONFLICT ... DO UPDATE clauses
    static final String TARGET_ALIAS = "target";

    private static final String RETURNING_INSERTED = " RETURNING TRUE";
    private static final String RETURNING_INSERT_FLAG = " RETURNING (xmax = 0)";

    /**
     * Prevents instantiation.
     */
    private SqlStatementBuilder() {
        throw new AssertionError("SqlStatementBuilder must not be instantiated.");
    }

    /**
     * Quotes an identifier with double quotes, doubling embedded quotes.
     *
     * @param name identifier
     * @return quoted identifier
     * @throws InvalidIdentifierException if the name is blank, contains NUL, or exceeds
     *         {@value #MAX_IDENTIFIER_BYTES} bytes in UTF-8
     */
    public static String quoteIdentifier(String name) {
        validateIdentifier(name);
        return '"' + name.replace("\"", "\"\"") + '"';
    }

    /**
     * Validates an identifier without quoting it.
     *
     * @param name identifier
     * @throws InvalidIdentifierException if the identifier is unusable
     */
    public static void validateIdentifier(String name) {
        if (StringUtils.isBlank(name)) {
            throw new InvalidIdentifierException("Identifier must not be blank");
        }
        if (name.indexOf('\0') >= 0) {
            throw new InvalidIdentifierException("Identifier must not contain NUL: " + name);
        }
        int bytes = name.getBytes(StandardCharsets.UTF_8).length;
        if (bytes > MAX_IDENTIFIER_BYTES) {
            throw new InvalidIdentifierException("Identifier exceeds " + MAX_IDENTIFIER_BYTES
                    + " bytes (" + bytes + " bytes): " + name);
        }
    }

    /**
     * Renders a schema-qualified, quoted table name.
     *
     * @param table table reference
     * @return {@code "schema"."table"}
     */
    public static String qualify(TableRef table) {
        return quoteIdentifier(table.getSchema()) + "." + quoteIdentifier(table.getTable());
    }

    /**
     * Returns the largest number of rows one statement can carry for the given column count.
     *
     * @param columnCount columns per row
     * @return row count, at least 1
     */
    public static int maxRowsPerStatement(int columnCount) {
        if (columnCount <= 0) {
            throw new IllegalArgumentException("columnCount must be positive: " + columnCount);
        }
        return Math.max(1, MAX_BIND_PARAMETERS / columnCount);
    }

    /**
     * Builds a plain multi-row insert.
     *
     * <pre>
     * INSERT INTO "s"."t" ("a","b") VALUES (?,?),(?,?) RETURNING TRUE
     * </pre>
     *
     * @param table target table
     * @param columns column names in binding order
     * @param rowCount number of rows
     * @return template
     */
    public static SqlTemplate buildInsert(TableRef table, List<String> columns, int rowCount) {
        return new SqlTemplate(insertPrefix(table, columns, rowCount) + RETURNING_INSERTED,
                columns, rowCount);
    }

    /**
     * Builds a multi-row insert with conflict handling.
     *
     * <ul>
     * <li>{@link ConflictPolicy#INSERT_MISSING}: {@code ON CONFLICT (keys) DO NOTHING}.</li>
     * <li>{@link ConflictPolicy#FILL_NULL_ONLY}: {@code ON CONFLICT (keys) DO UPDATE} setting each
     * updatable column to {@code COALESCE(target.col, EXCLUDED.col)}; rows where no null column
     * would receive a value are left untouched.</li>
     * </ul>
     *
     * @param table target table
     * @param columns column names in binding order
     * @param rowCount number of rows
     * @param conflictKeys columns of the unique constraint to arbitrate on
     * @param policy conflict policy
     * @param insertOnlyColumns columns written on insert but never filled on conflict
     * @return template
     */
    public static SqlTemplate buildInsertWithConflict(TableRef table, List<String> columns,
            int rowCount, List<String> conflictKeys, ConflictPolicy policy,
            Collection<String> insertOnlyColumns) {
        requireKeys(columns, conflictKeys);
        StringBuilder sql = new StringBuilder(insertPrefix(table, columns, rowCount));
        sql.append(" ON CONFLICT (").append(quoteList(conflictKeys)).append(')');

        List<String> fillable = updatableColumns(columns, conflictKeys, insertOnlyColumns);
        if (policy == ConflictPolicy.INSERT_MISSING || fillable.isEmpty()) {
            sql.append(" DO NOTHING").append(RETURNING_INSERTED);
            return new SqlTemplate(sql.toString(), columns, rowCount);
        }

        String alias = quoteIdentifier(TARGET_ALIAS);
        sql.append(" DO UPDATE SET ");
        sql.append(fillable.stream().map(SqlStatementBuilder::quoteIdentifier)
                .map(c -> c + " = COALESCE(" + alias + "." + c + ", EXCLUDED." + c + ")")
                .collect(Collectors.joining(", ")));
        sql.append(" WHERE ");
        sql.append(fillable.stream().map(SqlStatementBuilder::quoteIdentifier)
                .map(c -> "(" + alias + "." + c + " IS NULL AND EXCLUDED." + c + " IS NOT NULL)")
                .collect(Collectors.joining(" OR ")));
        sql.append(RETURNING_INSERT_FLAG);
        return new SqlTemplate(sql.toString(), columns, rowCount);
    }

    /**
     * Builds a multi-row upsert that overwrites every non-key column on conflict.
     *
     * @param table target table
     * @param columns column names in binding order
     * @param rowCount number of rows
     * @param conflictKeys columns of the unique constraint to arbitrate on
     * @return template
     */
    public static SqlTemplate buildUpsert(TableRef table, List<String> columns, int rowCount,
            List<String> conflictKeys) {
        requireKeys(columns, conflictKeys);
        List<String> targets = updatableColumns(columns, conflictKeys, Collections.emptySet());
        if (targets.isEmpty()) {
            // Only key columns: nothing to update, keep the statement valid
            targets = new ArrayList<>(conflictKeys);
        }
        StringBuilder sql = new StringBuilder(insertPrefix(table, columns, rowCount));
        sql.append(" ON CONFLICT (").append(quoteList(conflictKeys)).append(") DO UPDATE SET ");
        sql.append(targets.stream().map(SqlStatementBuilder::quoteIdentifier)
                .map(c -> c + " = EXCLUDED." + c).collect(Collectors.joining(", ")));
        sql.append(RETURNING_INSERT_FLAG);
        return new SqlTemplate(sql.toString(), columns, rowCount);
    }

    /**
     * Builds a lookup of which key tuples already exist.
     *
     * <pre>
     * SELECT "k1","k2" FROM "s"."t" WHERE ("k1","k2") IN ((?,?),(?,?))
     * </pre>
     *
     * @param table target table
     * @param keyColumns key columns
     * @param tupleCount number of key tuples
     * @return template whose columns are the key columns
     */
    public static SqlTemplate buildSelectExisting(TableRef table, List<String> keyColumns,
            int tupleCount) {
        requireNonEmpty(keyColumns, "keyColumns");
        requirePositive(tupleCount);
        String keys = quoteList(keyColumns);
        String tuple = placeholders(keyColumns.size());
        String sql = "SELECT " + keys + " FROM " + qualify(table) + " WHERE (" + keys + ") IN ("
                + String.join(",", Collections.nCopies(tupleCount, tuple)) + ")";
        return new SqlTemplate(sql, keyColumns, tupleCount);
    }

    /**
     * Builds a null-safe single-tuple delete, meant for JDBC batch execution over distinct key
     * combinations.
     *
     * <pre>
     * DELETE FROM "s"."t" WHERE "k1" IS NOT DISTINCT FROM ? AND "k2" IS NOT DISTINCT FROM ?
     * </pre>
     *
     * @param table target table
     * @param keyColumns key columns
     * @return template covering one key tuple
     */
    public static SqlTemplate buildDeleteByKeys(TableRef table, List<String> keyColumns) {
        requireNonEmpty(keyColumns, "keyColumns");
        String where = keyColumns.stream().map(SqlStatementBuilder::quoteIdentifier)
                .map(c -> c + " IS NOT DISTINCT FROM ?").collect(Collectors.joining(" AND "));
        return new SqlTemplate("DELETE FROM " + qualify(table) + " WHERE " + where, keyColumns,
                1);
    }

    /**
     * Builds the catalog query used by schema introspection.
     *
     * @return SQL with two placeholders: schema, table
     */
    public static String buildColumnCatalogQuery() {
        return "SELECT column_name, data_type, is_nullable FROM information_schema.columns"
                + " WHERE table_schema = ? AND table_name = ? ORDER BY ordinal_position";
    }

    private static String insertPrefix(TableRef table, List<String> columns, int rowCount) {
        requireNonEmpty(columns, "columns");
        requirePositive(rowCount);
        if ((long) columns.size() * rowCount > MAX_BIND_PARAMETERS) {
            throw new IllegalArgumentException("Statement would need "
                    + (long) columns.size() * rowCount + " parameters; limit is "
                    + MAX_BIND_PARAMETERS);
        }
        String row = placeholders(columns.size());
        // The alias is harmless for plain inserts and required by DO UPDATE clauses
        return "INSERT INTO " + qualify(table) + " AS " + quoteIdentifier(TARGET_ALIAS) + " ("
                + quoteList(columns) + ") VALUES "
                + String.join(",", Collections.nCopies(rowCount, row));
    }

    private static List<String> updatableColumns(List<String> columns, List<String> keys,
            Collection<String> insertOnly) {
        Set<String> excluded = new LinkedHashSet<>(keys);
        excluded.addAll(insertOnly);
        return columns.stream().filter(c -> !excluded.contains(c)).collect(Collectors.toList());
    }

    private static String quoteList(List<String> names) {
        return names.stream().map(SqlStatementBuilder::quoteIdentifier)
                .collect(Collectors.joining(","));
    }

    private static String placeholders(int count) {
        return "(" + String.join(",", Collections.nCopies(count, "?")) + ")";
    }

    private static void requireKeys(List<String> columns, List<String> keys) {
        requireNonEmpty(keys, "conflictKeys");
        for (String key : keys) {
            if (!columns.contains(key)) {
                throw new IllegalArgumentException(
                        "Conflict key " + key + " is not among the inserted columns " + columns);
            }
        }
    }

    private static void requireNonEmpty(List<String> list, String name) {
        if (list == null || list.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
    }

    private static void requirePositive(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("row count must be positive: " + count);
        }
    }
}
