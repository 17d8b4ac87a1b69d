package com.eventledger.core.config;

import com.eventledger.core.action.MonotonicSequenceGenerator;
import com.eventledger.core.action.SequenceGenerator;
import com.eventledger.core.notification.EventSubscriber;
import com.eventledger.core.notification.KafkaEventForwarder;
import com.eventledger.core.notification.LocalNotificationBus;
import com.eventledger.core.notification.NotificationSink;
import com.eventledger.core.replay.AggregateRebuilder;
import com.eventledger.core.replay.MutableReplayEngine;
import com.eventledger.core.store.AggregateStore;
import com.eventledger.core.store.EventCodec;
import com.eventledger.core.store.EventSourcingRegistry;
import com.eventledger.core.uow.UnitOfWorkManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.util.List;

/**
 * Event Ledger Core Spring Configuration
 *
 * Wires the engine around the application's aggregate stores. The application
 * supplies: an ObjectMapper with its event subtypes registered, one AggregateStore
 * bean per aggregate type, and (optionally) EventSubscriber beans.
 */
@Configuration
public class EventLedgerCoreConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EventCodec eventCodec(ObjectMapper objectMapper) {
        return new EventCodec(objectMapper);
    }

    @Bean
    public SequenceGenerator actionSequenceGenerator(@Value("${eventledger.node-id:0}") long nodeId, Clock clock) {
        return new MonotonicSequenceGenerator(nodeId, clock);
    }

    @Bean
    public EventSourcingRegistry eventSourcingRegistry(List<AggregateStore<?>> aggregateStores) {
        return new EventSourcingRegistry(aggregateStores);
    }

    // ─── Unit of Work / Replay ────────────────────────────────────────────────

    @Bean
    public UnitOfWorkManager unitOfWorkManager(TransactionOperations transactionOperations,
                                               EventSourcingRegistry registry,
                                               NotificationSink notificationSink,
                                               MeterRegistry meterRegistry) {
        return new UnitOfWorkManager(transactionOperations, registry, notificationSink, meterRegistry);
    }

    @Bean
    public MutableReplayEngine mutableReplayEngine(EventSourcingRegistry registry) {
        return new MutableReplayEngine(registry);
    }

    @Bean
    public AggregateRebuilder aggregateRebuilder(EventSourcingRegistry registry,
                                                 TransactionOperations transactionOperations) {
        return new AggregateRebuilder(registry, transactionOperations);
    }

    // ─── Notifications ────────────────────────────────────────────────────────

    @Bean
    public NotificationSink notificationSink(List<EventSubscriber> subscribers, MeterRegistry meterRegistry) {
        return new LocalNotificationBus(subscribers, meterRegistry);
    }

    @Bean
    @ConditionalOnProperty(name = "eventledger.notifications.kafka.enabled", havingValue = "true")
    public KafkaEventForwarder kafkaEventForwarder(KafkaTemplate<String, String> kafkaTemplate,
                                                   ObjectMapper objectMapper,
                                                   MeterRegistry meterRegistry,
                                                   @Value("${eventledger.notifications.kafka.topic-prefix:eventledger.}")
                                                   String topicPrefix) {
        return new KafkaEventForwarder(kafkaTemplate, objectMapper, meterRegistry, topicPrefix);
    }
}
