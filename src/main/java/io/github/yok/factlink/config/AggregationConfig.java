package io.github.yok.factlink.config;

import lombok.Data;

/**
 * Aggregation settings of a derived reference column.
 *
 * <pre>
 * aggregation:
 *   type: max_by
 *   order-column: 期末资产规模
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class AggregationConfig {

    // Aggregation strategy
    private AggregationType type = AggregationType.FIRST;
    // Numeric column deciding the winning row (MAX_BY)
    private String orderColumn;
    // Separator between values (CONCAT_DISTINCT)
    private String separator = "+";
    // Sort values before joining (CONCAT_DISTINCT)
    private boolean sort = true;
    // Text with {field} placeholders (TEMPLATE)
    private String template;
}
