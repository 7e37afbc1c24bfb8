package io.github.yok.factlink.config;

import io.github.yok.factlink.sql.TableRef;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * A fact table and the ordered list of foreign keys backfilled before it is loaded.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class FactTableEntry {

    // Schema of the fact table
    private String schema = "public";
    // Fact table name
    private String table;
    // Foreign keys in execution order
    private List<ForeignKeyEntry> foreignKeys = new ArrayList<>();

    /**
     * Returns the fact table as a {@link TableRef}.
     *
     * @return fact table reference
     */
    public TableRef getTableRef() {
        return TableRef.of(schema, table);
    }
}
