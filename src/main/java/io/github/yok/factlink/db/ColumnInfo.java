package io.github.yok.factlink.db;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * One column as reported by {@code information_schema.columns}.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@RequiredArgsConstructor
@EqualsAndHashCode
@ToString
public final class ColumnInfo {

    // Column name exactly as stored in the catalog
    private final String name;
    // information_schema data_type (e.g., "character varying", "numeric")
    private final String dataType;
    // is_nullable = 'YES'
    private final boolean nullable;
}
