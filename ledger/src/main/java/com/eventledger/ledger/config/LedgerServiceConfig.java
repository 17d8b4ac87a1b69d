package com.eventledger.ledger.config;

import com.eventledger.core.action.Action;
import com.eventledger.core.store.EventCodec;
import com.eventledger.core.store.jpa.AggregateRecordRepository;
import com.eventledger.core.store.jpa.JpaAggregateStore;
import com.eventledger.core.store.jpa.JpaEventStore;
import com.eventledger.core.store.jpa.StoredEventRepository;
import com.eventledger.ledger.domain.Account;
import com.eventledger.ledger.domain.LedgerJacksonModule;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Ledger Service Spring Configuration
 *
 * One JPA event store and one JPA aggregate store per aggregate type; both types
 * share the event and aggregate tables, partitioned by the aggregate_type column.
 */
@Configuration
public class LedgerServiceConfig {

    // ─── Stores ───────────────────────────────────────────────────────────────

    @Bean
    public JpaEventStore accountEventStore(StoredEventRepository repository, EventCodec codec, Clock clock) {
        return new JpaEventStore(Account.TYPE, repository, codec, clock);
    }

    @Bean
    public JpaEventStore actionEventStore(StoredEventRepository repository, EventCodec codec, Clock clock) {
        return new JpaEventStore(Action.TYPE, repository, codec, clock);
    }

    @Bean
    public JpaAggregateStore<Account> accountStore(@Qualifier("accountEventStore") JpaEventStore accountEventStore, EventCodec codec,
                                                   AggregateRecordRepository repository, Clock clock) {
        return new JpaAggregateStore<>(Account.TYPE, accountEventStore, codec, repository, clock);
    }

    @Bean
    public JpaAggregateStore<Action> actionStore(@Qualifier("actionEventStore") JpaEventStore actionEventStore, EventCodec codec,
                                                 AggregateRecordRepository repository, Clock clock) {
        return new JpaAggregateStore<>(Action.TYPE, actionEventStore, codec, repository, clock);
    }

    // ─── Kafka Producer ───────────────────────────────────────────────────────

    @Bean
    @ConditionalOnProperty(name = "eventledger.notifications.kafka.enabled", havingValue = "true")
    public ProducerFactory<String, String> producerFactory(
            @Value("${spring.kafka.bootstrap-servers}") String bootstrapServers) {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);

        // Idempotent producer: a retried send is not duplicated on the broker
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 5);

        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.RETRY_BACKOFF_MS_CONFIG, 1000);
        props.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, "gzip");
        props.put(ProducerConfig.LINGER_MS_CONFIG, 5);

        return new DefaultKafkaProducerFactory<>(props);
    }

    @Bean
    @ConditionalOnProperty(name = "eventledger.notifications.kafka.enabled", havingValue = "true")
    public KafkaTemplate<String, String> kafkaTemplate(ProducerFactory<String, String> producerFactory) {
        return new KafkaTemplate<>(producerFactory);
    }

    // ─── Jackson ──────────────────────────────────────────────────────────────

    /**
     * Event payloads, aggregate snapshots and the read model all go through this mapper,
     * so it must know the ledger's action subtypes.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(new LedgerJacksonModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
