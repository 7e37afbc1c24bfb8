package io.github.yok.factlink.core;

import io.github.yok.factlink.config.FactTableEntry;
import io.github.yok.factlink.config.ForeignKeyConfigValidator;
import io.github.yok.factlink.config.ForeignKeysProperties;
import io.github.yok.factlink.config.WarehouseProperties;
import io.github.yok.factlink.db.ConnectionPoolManager;
import io.github.yok.factlink.db.SchemaIntrospector;
import io.github.yok.factlink.error.ConfigurationException;

/**
 * Creates a {@link WritePathRun} per domain and run. The schema cache lives as long as the run.
 *
 * @author Yasuharu.Okawauchi
 */
public class WritePathFactory {

    private final ConnectionPoolManager pool;
    private final ForeignKeysProperties foreignKeys;
    private final int batchSize;

    /**
     * Creates the factory and validates all foreign key configuration.
     *
     * @param pool shared connection pool
     * @param warehouse warehouse settings
     * @param foreignKeys foreign key configuration of every domain
     * @throws ConfigurationException if any configuration is invalid
     */
    public WritePathFactory(ConnectionPoolManager pool, WarehouseProperties warehouse,
            ForeignKeysProperties foreignKeys) {
        ForeignKeyConfigValidator.validate(foreignKeys);
        if (warehouse.getBatchSize() < 1) {
            throw new ConfigurationException(
                    "warehouse.batch-size must be positive: " + warehouse.getBatchSize());
        }
        this.pool = pool;
        this.foreignKeys = foreignKeys;
        this.batchSize = warehouse.getBatchSize();
    }

    /**
     * Starts a run for a domain.
     *
     * @param domain configured domain name
     * @return new run with a fresh schema cache
     * @throws ConfigurationException if the domain is not configured
     */
    public WritePathRun newRun(String domain) {
        FactTableEntry factTable = foreignKeys.getRequired(domain);
        SchemaIntrospector introspector = new SchemaIntrospector(pool);
        return new WritePathRun(domain, factTable,
                new ReferenceBackfillEngine(domain, factTable, pool, introspector, batchSize),
                new BatchTransactionalLoader(pool, introspector, batchSize));
    }
}
