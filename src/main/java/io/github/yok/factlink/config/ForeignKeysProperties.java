package io.github.yok.factlink.config;

import io.github.yok.factlink.error.ConfigurationException;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code backfill} section, normally imported from
 * {@code foreign-keys.yml}.
 *
 * <pre>
 * backfill:
 *   fact-tables:
 *     "[annuity_performance]":
 *       schema: business
 *       table: 规模明细
 *       foreign-keys:
 *         - name: plans
 *           ...
 * </pre>
 *
 * <p>
 * Keys of {@code fact-tables} are domain names; bracket keys containing {@code _} so that
 * binding keeps them verbatim. Entries are validated by
 * {@link ForeignKeyConfigValidator} when the write path is wired.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "backfill")
@Data
public class ForeignKeysProperties {

    /**
     * Fact tables keyed by domain name.
     */
    private Map<String, FactTableEntry> factTables = new LinkedHashMap<>();

    /**
     * Returns the fact table configuration of a domain.
     *
     * @param domain domain name
     * @return fact table entry
     * @throws ConfigurationException if the domain is not configured
     */
    public FactTableEntry getRequired(String domain) {
        FactTableEntry entry = factTables.get(domain);
        if (entry == null) {
            throw new ConfigurationException(
                    "No fact table configured for domain '" + domain + "'. Known domains: "
                            + factTables.keySet());
        }
        return entry;
    }
}
