package io.github.yok.factlink.sql;

import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A {@code (schema, table)} pair. Schema and table are always used together and are only ever
 * rendered into SQL through {@link SqlStatementBuilder#qualify(TableRef)}.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
public final class TableRef {

    private final String schema;
    private final String table;

    private TableRef(String schema, String table) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.table = Objects.requireNonNull(table, "table");
    }

    /**
     * Creates a table reference.
     *
     * @param schema schema name
     * @param table table name
     * @return table reference
     */
    public static TableRef of(String schema, String table) {
        return new TableRef(schema, table);
    }

    /**
     * Returns {@code schema.table} without quoting, for logs and error messages.
     *
     * @return display name
     */
    @Override
    public String toString() {
        return schema + "." + table;
    }
}
