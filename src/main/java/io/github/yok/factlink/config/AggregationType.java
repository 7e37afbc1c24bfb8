package io.github.yok.factlink.config;

/**
 * How a derived reference column is computed from all fact rows sharing one candidate key.
 *
 * @author Yasuharu.Okawauchi
 */
public enum AggregationType {

    /**
     * First non-blank value in fact-row order (default).
     */
    FIRST,

    /**
     * Value taken from the row with the largest numeric {@code orderColumn}.
     */
    MAX_BY,

    /**
     * Distinct values joined with {@code separator}.
     */
    CONCAT_DISTINCT,

    /**
     * Static text with {@code {field}} placeholders filled by first non-blank values.
     */
    TEMPLATE,

    /**
     * Number of distinct non-blank values.
     */
    COUNT_DISTINCT
}
