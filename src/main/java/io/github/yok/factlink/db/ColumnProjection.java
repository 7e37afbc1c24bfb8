package io.github.yok.factlink.db;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * Records filtered down to the columns a target table accepts.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public final class ColumnProjection {

    // Projected records; each map holds only kept columns, in catalog order
    private final List<Map<String, Object>> records;
    // Kept columns in catalog order
    private final List<String> columns;
    // Removed column names in first-seen order
    private final List<String> removedColumns;

    ColumnProjection(List<Map<String, Object>> records, List<String> columns,
            List<String> removedColumns) {
        this.records = ImmutableList.copyOf(records);
        this.columns = ImmutableList.copyOf(columns);
        this.removedColumns = ImmutableList.copyOf(removedColumns);
    }
}
