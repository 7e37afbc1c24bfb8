package io.github.yok.factlink.db;

import com.google.common.collect.ImmutableList;
import io.github.yok.factlink.error.SchemaDriftException;
import io.github.yok.factlink.error.WarehouseConnectionException;
import io.github.yok.factlink.sql.SqlStatementBuilder;
import io.github.yok.factlink.sql.TableRef;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads table columns from {@code information_schema.columns} and projects records onto them.
 *
 * <h2>Caching</h2>
 *
 * <p>
 * Column lists are cached per {@code (schema, table)} for the lifetime of this instance and are
 * never invalidated; a schema change requires a new instance. The cache is not synchronized: use
 * one instance per run, or guard it externally when sharing.
 * </p>
 *
 * <h2>Projection events</h2>
 *
 * <ul>
 * <li>more than {@value #WARN_THRESHOLD} removed columns: WARN with the full list</li>
 * <li>1 to {@value #WARN_THRESHOLD} removed columns: INFO</li>
 * <li>nothing removed: no event</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SchemaIntrospector {

    /**
     * Removed-column count above which projection logs at WARN.
     */
    public static final int WARN_THRESHOLD = 5;

    private final ConnectionPoolManager pool;

    // (schema, table) -> columns in catalog order
    private final Map<TableRef, List<ColumnInfo>> cache = new HashMap<>();

    /**
     * Creates an introspector with an empty cache.
     *
     * @param pool connection pool
     */
    public SchemaIntrospector(ConnectionPoolManager pool) {
        this.pool = pool;
    }

    /**
     * Returns column metadata in catalog order, querying the catalog on first use.
     *
     * @param schema schema name
     * @param table table name
     * @return columns in ordinal order
     * @throws SchemaDriftException if the table does not exist (no columns reported)
     */
    public List<ColumnInfo> getTableColumns(String schema, String table) {
        TableRef ref = TableRef.of(schema, table);
        List<ColumnInfo> columns = cache.get(ref);
        if (columns == null) {
            columns = queryColumns(ref);
            if (columns.isEmpty()) {
                throw new SchemaDriftException(
                        "Table " + ref + " not found or has no columns");
            }
            cache.put(ref, columns);
            log.debug("[{}] Columns cached: {}", ref, columns.size());
        }
        return columns;
    }

    /**
     * Returns the names of the columns a table has.
     *
     * @param schema schema name
     * @param table table name
     * @return unmodifiable set in catalog order
     * @throws SchemaDriftException if the table does not exist
     */
    public Set<String> getAllowedColumns(String schema, String table) {
        Set<String> names = getTableColumns(schema, table).stream().map(ColumnInfo::getName)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        return Collections.unmodifiableSet(names);
    }

    /**
     * Filters every record to the columns the table has.
     *
     * @param records records with uniform keys
     * @param schema schema name
     * @param table table name
     * @return projected records, kept columns and removed column names
     * @throws SchemaDriftException if the table is missing, or no column of the records exists in
     *         it
     */
    public ColumnProjection projectColumns(List<? extends Map<String, ?>> records, String schema,
            String table) {
        if (records.isEmpty()) {
            return new ColumnProjection(ImmutableList.of(), ImmutableList.of(),
                    ImmutableList.of());
        }
        Set<String> allowed = getAllowedColumns(schema, table);

        Set<String> seen = new LinkedHashSet<>();
        for (Map<String, ?> record : records) {
            seen.addAll(record.keySet());
        }
        List<String> removed = seen.stream().filter(c -> !allowed.contains(c))
                .collect(Collectors.toList());
        List<String> kept = allowed.stream().filter(seen::contains).collect(Collectors.toList());
        if (kept.isEmpty()) {
            throw new SchemaDriftException("No column of the records exists in " + schema + "."
                    + table + "; record columns: " + seen);
        }

        List<Map<String, Object>> projected = new ArrayList<>(records.size());
        for (Map<String, ?> record : records) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (String column : kept) {
                if (record.containsKey(column)) {
                    row.put(column, record.get(column));
                }
            }
            projected.add(Collections.unmodifiableMap(row));
        }

        if (removed.size() > WARN_THRESHOLD) {
            log.warn("[{}.{}] Removed {} column(s) not present in target table: {}", schema,
                    table, removed.size(), removed);
        } else if (!removed.isEmpty()) {
            log.info("[{}.{}] Removed {} column(s) not present in target table: {}", schema,
                    table, removed.size(), removed);
        }
        return new ColumnProjection(projected, kept, removed);
    }

    private List<ColumnInfo> queryColumns(TableRef ref) {
        Connection connection = pool.acquire();
        try (PreparedStatement ps =
                connection.prepareStatement(SqlStatementBuilder.buildColumnCatalogQuery())) {
            ps.setString(1, ref.getSchema());
            ps.setString(2, ref.getTable());
            List<ColumnInfo> columns = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    columns.add(new ColumnInfo(rs.getString(1), rs.getString(2),
                            "YES".equalsIgnoreCase(rs.getString(3))));
                }
            }
            return ImmutableList.copyOf(columns);
        } catch (SQLException e) {
            throw new WarehouseConnectionException(
                    "Catalog query failed for " + ref + ": " + e.getMessage(), e);
        } finally {
            pool.release(connection);
        }
    }
}
