package io.github.yok.factlink.config;

import io.github.yok.factlink.core.WritePathFactory;
import io.github.yok.factlink.db.ConnectionPoolManager;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the write path from {@code warehouse.*} and {@code backfill.*} properties.
 *
 * @author Yasuharu.Okawauchi
 */
@Configuration
@EnableConfigurationProperties({WarehouseProperties.class, ForeignKeysProperties.class})
public class WritePathConfiguration {

    @Bean(destroyMethod = "close")
    public ConnectionPoolManager connectionPoolManager(WarehouseProperties warehouse) {
        return new ConnectionPoolManager(warehouse);
    }

    @Bean
    public WritePathFactory writePathFactory(ConnectionPoolManager pool,
            WarehouseProperties warehouse, ForeignKeysProperties foreignKeys) {
        return new WritePathFactory(pool, warehouse, foreignKeys);
    }
}
