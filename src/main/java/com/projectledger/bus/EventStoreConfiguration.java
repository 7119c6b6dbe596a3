package com.projectledger.bus;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectledger.contract.EventTypeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

@Configuration
public class EventStoreConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EventStoreConfiguration.class);

    @Bean
    @ConditionalOnProperty(name = "projectledger.event-store.type", havingValue = "jdbc", matchIfMissing = true)
    public EventStore jdbcEventStore(JdbcTemplate jdbcTemplate,
                                     TransactionTemplate transactionTemplate,
                                     EventTypeRegistry registry,
                                     ObjectMapper objectMapper) {
        log.info("Using JDBC event store");
        return new JdbcEventStore(jdbcTemplate, transactionTemplate, registry, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "projectledger.event-store.type", havingValue = "memory")
    public EventStore inMemoryEventStore() {
        log.info("Using in-memory event store");
        return new InMemoryEventStore();
    }
}
