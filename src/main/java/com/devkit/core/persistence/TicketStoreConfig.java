package com.devkit.core.persistence;

import com.devkit.config.DevkitProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.nio.file.Path;

/**
 * Selects the {@link TicketStore} from {@code devkit.ticket-store.type}.
 * <p>
 * {@code jdbc} builds a {@link DataSource} from {@code devkit.ticket-store.jdbc.*} and creates the
 * ticket tables on startup; {@code memory} keeps tickets in process; {@code file} (the default)
 * reads and writes JSON documents.
 */
@Configuration
public class TicketStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(TicketStoreConfig.class);

    @Bean
    @ConditionalOnProperty(name = "devkit.ticket-store.type", havingValue = "jdbc")
    public DataSource ticketDataSource(DevkitProperties properties) {
        var jdbc = properties.getTicketStore().getJdbc();
        if (jdbc.getUrl() == null || jdbc.getUrl().isBlank()) {
            throw new IllegalStateException("devkit.ticket-store.jdbc.url is required when the ticket store type is jdbc");
        }
        return DataSourceBuilder.create()
                .url(jdbc.getUrl())
                .username(jdbc.getUsername())
                .password(jdbc.getPassword())
                .build();
    }

    @Bean
    @ConditionalOnProperty(name = "devkit.ticket-store.type", havingValue = "jdbc")
    public TicketStore jdbcTicketStore(DataSource ticketDataSource) throws Exception {
        log.info("Configuring JDBC ticket store");
        var store = new JdbcTicketStore(ticketDataSource);
        store.createTables();
        return store;
    }

    @Bean
    @ConditionalOnProperty(name = "devkit.ticket-store.type", havingValue = "memory")
    public TicketStore memoryTicketStore() {
        log.info("Using in-memory ticket store (statuses will not persist across restarts)");
        return new InMemoryTicketStore();
    }

    @Bean
    @ConditionalOnProperty(name = "devkit.ticket-store.type", havingValue = "file", matchIfMissing = true)
    public TicketStore fileTicketStore(DevkitProperties properties) {
        Path directory = Path.of(properties.getTicketStore().getDirectory());
        log.info("Using JSON file ticket store in {}", directory.toAbsolutePath());
        return new JsonFileTicketStore(directory);
    }
}
