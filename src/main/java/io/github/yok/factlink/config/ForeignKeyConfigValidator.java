package io.github.yok.factlink.config;

import io.github.yok.factlink.error.ConfigurationException;
import io.github.yok.factlink.sql.SqlStatementBuilder;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Validates foreign key configuration before any batch is processed.
 *
 * <h2>Rules</h2>
 *
 * <ul>
 * <li>Fact and reference table identifiers must be usable as quoted PostgreSQL identifiers.</li>
 * <li>Entry names are required and unique per fact table.</li>
 * <li>{@code source-columns} is non-empty and {@code target-key-columns} has the same length.</li>
 * <li>Backfill column targets are unique and never repeat a key column.</li>
 * <li>{@code max_by} needs {@code order-column}; {@code template} needs {@code template}.</li>
 * <li>{@code depends-on} may only name entries declared <em>earlier</em> in the list. Entries run in
 * declared order, so this rules out both forward references and cycles.</li>
 * </ul>
 *
 * <p>
 * Any violation raises {@link ConfigurationException}; nothing is defaulted silently.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ForeignKeyConfigValidator {

    /**
     * Prevents instantiation.
     */
    private ForeignKeyConfigValidator() {
        throw new AssertionError("ForeignKeyConfigValidator must not be instantiated.");
    }

    /**
     * Validates every configured fact table.
     *
     * @param properties bound {@code backfill} section
     * @throws ConfigurationException on the first violation
     */
    public static void validate(ForeignKeysProperties properties) {
        if (properties == null || properties.getFactTables() == null) {
            throw new ConfigurationException("backfill configuration is missing");
        }
        for (Map.Entry<String, FactTableEntry> e : properties.getFactTables().entrySet()) {
            validate(e.getKey(), e.getValue());
        }
        log.info("Foreign key configuration validated: domains={}",
                properties.getFactTables().keySet());
    }

    /**
     * Validates one fact table and its foreign keys.
     *
     * @param domain domain name (configuration key)
     * @param factTable fact table entry
     * @throws ConfigurationException on the first violation
     */
    public static void validate(String domain, FactTableEntry factTable) {
        if (StringUtils.isBlank(domain)) {
            throw new ConfigurationException("Domain name must not be blank");
        }
        if (factTable == null) {
            throw new ConfigurationException("[" + domain + "] fact table entry is missing");
        }
        identifier(domain, "schema", factTable.getSchema());
        identifier(domain, "table", factTable.getTable());

        List<ForeignKeyEntry> entries = factTable.getForeignKeys();
        if (entries == null) {
            throw new ConfigurationException("[" + domain + "] foreign-keys must not be null");
        }
        Set<String> declared = new HashSet<>();
        for (int i = 0; i < entries.size(); i++) {
            ForeignKeyEntry entry = entries.get(i);
            if (entry == null) {
                throw new ConfigurationException("[" + domain + "] foreign-keys[" + i
                        + "] is empty");
            }
            String ctx = domain + "/" + (StringUtils.isBlank(entry.getName()) ? "#" + i
                    : entry.getName());
            validateEntry(ctx, entry);
            for (String dep : entry.getDependsOn()) {
                if (entry.getName().equals(dep)) {
                    throw new ConfigurationException("[" + ctx + "] depends-on references itself");
                }
                if (!declared.contains(dep)) {
                    throw new ConfigurationException("[" + ctx + "] depends-on '" + dep
                            + "' must name an entry declared earlier; declared so far: "
                            + declared);
                }
            }
            if (!declared.add(entry.getName())) {
                throw new ConfigurationException(
                        "[" + domain + "] duplicate foreign key name: " + entry.getName());
            }
        }
    }

    private static void validateEntry(String ctx, ForeignKeyEntry entry) {
        if (StringUtils.isBlank(entry.getName())) {
            throw new ConfigurationException("[" + ctx + "] name is required");
        }
        identifier(ctx, "target-schema", entry.getTargetSchema());
        identifier(ctx, "target-table", entry.getTargetTable());
        if (entry.getConflictPolicy() == null) {
            throw new ConfigurationException("[" + ctx + "] conflict-policy is required");
        }

        List<String> sources = entry.getSourceColumns();
        List<String> keys = entry.getTargetKeyColumns();
        if (sources == null || sources.isEmpty()) {
            throw new ConfigurationException("[" + ctx + "] source-columns is required");
        }
        if (keys == null || keys.size() != sources.size()) {
            throw new ConfigurationException("[" + ctx + "] target-key-columns must list "
                    + sources.size() + " column(s) matching source-columns " + sources);
        }
        for (String source : sources) {
            if (StringUtils.isBlank(source)) {
                throw new ConfigurationException("[" + ctx + "] source-columns contains a blank");
            }
        }
        Set<String> targets = new HashSet<>();
        for (String key : keys) {
            identifier(ctx, "target-key-columns", key);
            if (!targets.add(key)) {
                throw new ConfigurationException("[" + ctx + "] duplicate key column " + key);
            }
        }

        if (entry.getBackfillColumns() != null) {
            for (BackfillColumnMapping mapping : entry.getBackfillColumns()) {
                validateMapping(ctx, mapping, targets);
            }
        }
        if (entry.getSkipValues() != null && entry.getSkipValues().contains(null)) {
            throw new ConfigurationException("[" + ctx + "] skip-values must not contain null");
        }
        if (entry.getDependsOn() == null) {
            throw new ConfigurationException("[" + ctx + "] depends-on must not be null");
        }
    }

    private static void validateMapping(String ctx, BackfillColumnMapping mapping,
            Set<String> targets) {
        if (mapping == null || StringUtils.isBlank(mapping.getSource())) {
            throw new ConfigurationException("[" + ctx + "] backfill-columns source is required");
        }
        identifier(ctx, "backfill-columns target", mapping.getTarget());
        if (!targets.add(mapping.getTarget())) {
            throw new ConfigurationException(
                    "[" + ctx + "] column " + mapping.getTarget() + " is filled more than once");
        }
        AggregationConfig agg = mapping.getAggregation();
        if (agg == null) {
            return;
        }
        if (agg.getType() == null) {
            throw new ConfigurationException("[" + ctx + "] aggregation.type is required for "
                    + mapping.getTarget());
        }
        switch (agg.getType()) {
            case MAX_BY:
                if (StringUtils.isBlank(agg.getOrderColumn())) {
                    throw new ConfigurationException("[" + ctx
                            + "] aggregation.order-column is required when type is max_by");
                }
                break;
            case TEMPLATE:
                if (StringUtils.isBlank(agg.getTemplate())) {
                    throw new ConfigurationException(
                            "[" + ctx + "] aggregation.template is required when type is template");
                }
                break;
            case CONCAT_DISTINCT:
                if (agg.getSeparator() == null) {
                    throw new ConfigurationException("[" + ctx
                            + "] aggregation.separator must not be null for concat_distinct");
                }
                break;
            default:
                break;
        }
    }

    private static void identifier(String ctx, String field, String value) {
        try {
            SqlStatementBuilder.validateIdentifier(value);
        } catch (ConfigurationException e) {
            throw new ConfigurationException("[" + ctx + "] " + field + ": " + e.getMessage());
        }
    }
}
