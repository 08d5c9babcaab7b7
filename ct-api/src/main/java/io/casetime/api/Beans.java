package io.casetime.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.casetime.engine.TimelineService;
import io.casetime.store.EntityRegistry;
import io.casetime.store.FactStore;
import io.casetime.store.InMemoryEntityRegistry;
import io.casetime.store.InMemoryFactStore;
import io.casetime.store.pg.JdbcEntityRegistry;
import io.casetime.store.pg.PostgresFactStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionOperations;

@Configuration
@EnableConfigurationProperties(TimelineProperties.class)
public class Beans {
    @Bean
    @Profile("inmem")
    FactStore inMemoryStore() {
        return new InMemoryFactStore();
    }

    @Bean
    @Profile("inmem")
    EntityRegistry inMemoryEntities() {
        return new InMemoryEntityRegistry();
    }

    @Bean
    @Profile("pg")
    FactStore postgresStore(JdbcTemplate jdbc, ObjectMapper mapper, TransactionOperations tx) {
        return new PostgresFactStore(jdbc, mapper, tx);
    }

    @Bean
    @Profile("pg")
    EntityRegistry jdbcEntities(JdbcTemplate jdbc, ObjectMapper mapper) {
        return new JdbcEntityRegistry(jdbc, mapper);
    }

    @Bean
    TimelineService timelineService(FactStore facts, EntityRegistry entities, TimelineProperties props) {
        return TimelineService.create(facts, entities, props.toSettings());
    }
}
