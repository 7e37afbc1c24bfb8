package io.github.yok.factlink.config;

import lombok.Data;

/**
 * Maps a fact column to a column of the reference table being backfilled.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class BackfillColumnMapping {

    // Fact column to read from
    private String source;
    // Reference table column to fill
    private String target;
    // When true, a missing source column yields NULL instead of a warning
    private boolean optional;
    // Aggregation strategy; null means FIRST
    private AggregationConfig aggregation;
}
