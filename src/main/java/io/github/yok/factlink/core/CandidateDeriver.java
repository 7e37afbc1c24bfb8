package io.github.yok.factlink.core;

import io.github.yok.factlink.config.AggregationConfig;
import io.github.yok.factlink.config.AggregationType;
import io.github.yok.factlink.config.BackfillColumnMapping;
import io.github.yok.factlink.config.ForeignKeyEntry;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Derives distinct reference rows from fact records for one foreign key entry.
 *
 * <h2>Key extraction</h2>
 *
 * <ul>
 * <li>String key values are trimmed.</li>
 * <li>A row is skipped when any key component is null, blank (if {@code skip-blank-values}), or
 * equal to one of {@code skip-values} after trimming.</li>
 * <li>Integral numbers are widened to {@link Long} so that {@code 1} and {@code 1L} are one
 * key.</li>
 * </ul>
 *
 * <h2>Derived columns</h2>
 *
 * <p>
 * Every backfill column is aggregated over all fact rows sharing the key, as configured by its
 * {@link AggregationType}. Candidates are returned in first-seen key order.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CandidateDeriver {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^{}]+)\\}");

    /**
     * Derives the candidates of one entry.
     *
     * @param records fact records
     * @param entry foreign key entry
     * @return distinct candidates; empty when no row carries a usable key
     */
    public List<BackfillCandidate> derive(List<? extends Map<String, ?>> records,
            ForeignKeyEntry entry) {
        if (records.isEmpty()) {
            return List.of();
        }
        Set<String> present = new LinkedHashSet<>();
        for (Map<String, ?> record : records) {
            present.addAll(record.keySet());
        }
        List<String> missing = entry.getSourceColumns().stream().filter(c -> !present.contains(c))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            log.warn("[{}] Source column(s) {} absent from fact records; no candidates derived",
                    entry.getName(), missing);
            return List.of();
        }

        // Grouped by canonical text so that 1, 1L and 1.00 collapse into one candidate;
        // the first raw tuple seen is the one written.
        Map<List<String>, List<Object>> rawKeys = new LinkedHashMap<>();
        Map<List<String>, List<Map<String, ?>>> groups = new LinkedHashMap<>();
        int skipped = 0;
        for (Map<String, ?> record : records) {
            List<Object> key = extractKey(record, entry);
            if (key == null) {
                skipped++;
                continue;
            }
            List<String> canonical = KeyValues.canonical(key);
            rawKeys.putIfAbsent(canonical, key);
            groups.computeIfAbsent(canonical, k -> new ArrayList<>()).add(record);
        }
        if (skipped > 0) {
            log.debug("[{}] Skipped {} row(s) without a usable key", entry.getName(), skipped);
        }

        Set<String> warned = new LinkedHashSet<>();
        List<BackfillCandidate> candidates = new ArrayList<>(groups.size());
        for (Map.Entry<List<String>, List<Map<String, ?>>> group : groups.entrySet()) {
            List<Object> key = rawKeys.get(group.getKey());
            Map<String, Object> values = new LinkedHashMap<>();
            List<String> keyColumns = entry.getTargetKeyColumns();
            for (int i = 0; i < keyColumns.size(); i++) {
                values.put(keyColumns.get(i), key.get(i));
            }
            for (BackfillColumnMapping mapping : entry.getBackfillColumns()) {
                if (!present.contains(mapping.getSource())) {
                    if (!mapping.isOptional() && warned.add(mapping.getSource())) {
                        log.warn("[{}] Backfill source column {} absent from fact records; {} "
                                + "left NULL", entry.getName(), mapping.getSource(),
                                mapping.getTarget());
                    }
                    values.put(mapping.getTarget(), null);
                    continue;
                }
                values.put(mapping.getTarget(), aggregate(group.getValue(), mapping));
            }
            candidates.add(new BackfillCandidate(key, values));
        }
        log.info("[{}] Derived {} candidate(s) from {} fact row(s)", entry.getName(),
                candidates.size(), records.size());
        return candidates;
    }

    private List<Object> extractKey(Map<String, ?> record, ForeignKeyEntry entry) {
        List<Object> key = new ArrayList<>(entry.getSourceColumns().size());
        for (String column : entry.getSourceColumns()) {
            Object value = normalizeKey(record.get(column));
            if (value == null) {
                return null;
            }
            if (value instanceof String) {
                String s = (String) value;
                if (entry.isSkipBlankValues() && s.isEmpty()) {
                    return null;
                }
            }
            if (entry.getSkipValues().contains(value.toString().trim())) {
                return null;
            }
            key.add(value);
        }
        return key;
    }

    /**
     * Normalizes a key component: trims strings, widens integral numbers to {@link Long}.
     *
     * @param value raw value
     * @return normalized value, or {@code null}
     */
    static Object normalizeKey(Object value) {
        if (value instanceof String) {
            return ((String) value).trim();
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        return value;
    }

    private Object aggregate(List<Map<String, ?>> rows, BackfillColumnMapping mapping) {
        AggregationConfig agg = mapping.getAggregation();
        AggregationType type = agg == null ? AggregationType.FIRST : agg.getType();
        String source = mapping.getSource();
        switch (type) {
            case MAX_BY:
                return maxBy(rows, source, agg.getOrderColumn());
            case CONCAT_DISTINCT:
                return concatDistinct(rows, source, agg.getSeparator(), agg.isSort());
            case TEMPLATE:
                return template(rows, agg.getTemplate());
            case COUNT_DISTINCT:
                long count = distinct(rows, source).size();
                return count == 0 ? null : count;
            case FIRST:
            default:
                return first(rows, source);
        }
    }

    private static Object first(List<Map<String, ?>> rows, String column) {
        for (Map<String, ?> row : rows) {
            Object value = row.get(column);
            if (isPresent(value)) {
                return value instanceof String ? ((String) value).trim() : value;
            }
        }
        return null;
    }

    private static Object maxBy(List<Map<String, ?>> rows, String column, String orderColumn) {
        BigDecimal best = null;
        Map<String, ?> winner = null;
        for (Map<String, ?> row : rows) {
            BigDecimal order = toDecimal(row.get(orderColumn));
            // Strictly greater: ties keep the first row
            if (order != null && (best == null || order.compareTo(best) > 0)) {
                best = order;
                winner = row;
            }
        }
        if (winner == null) {
            return first(rows, column);
        }
        Object value = winner.get(column);
        return value instanceof String ? ((String) value).trim() : value;
    }

    private static String concatDistinct(List<Map<String, ?>> rows, String column,
            String separator, boolean sort) {
        List<String> values = new ArrayList<>(distinct(rows, column));
        if (values.isEmpty()) {
            return null;
        }
        if (sort) {
            values.sort(null);
        }
        return String.join(separator, values);
    }

    private static String template(List<Map<String, ?>> rows, String template) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            Object value = first(rows, m.group(1));
            m.appendReplacement(sb, Matcher.quoteReplacement(value == null ? "" : value.toString()));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static Set<String> distinct(List<Map<String, ?>> rows, String column) {
        Set<String> values = new LinkedHashSet<>();
        for (Map<String, ?> row : rows) {
            Object value = row.get(column);
            if (isPresent(value)) {
                values.add(value.toString().trim());
            }
        }
        return values;
    }

    private static boolean isPresent(Object value) {
        return value != null && !(value instanceof String && StringUtils.isBlank((String) value));
    }

    private static BigDecimal toDecimal(Object value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof BigInteger) {
            return new BigDecimal((BigInteger) value);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? BigDecimal.valueOf(d) : null;
        }
        if (value instanceof Number) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof String && StringUtils.isNotBlank((String) value)) {
            try {
                return new BigDecimal(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
