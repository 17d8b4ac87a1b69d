package com.eventledger.core.notification;

import com.eventledger.core.event.RecordedEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Forwards every committed event to Kafka.
 *
 * Topic:   {topicPrefix}{aggregateType}, e.g. "eventledger.account"
 * Key:     aggregate id, so one aggregate's events stay on one partition
 * Headers: event-type, insertion-id, sequence-number (when sequenced)
 *
 * Consumers must treat the stream as at-least-once: a redelivered event carries
 * the same insertion id.
 */
@Slf4j
public class KafkaEventForwarder implements EventSubscriber {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String topicPrefix;
    private final Counter publishSuccessCounter;
    private final Counter publishErrorCounter;
    private final Timer publishTimer;

    public KafkaEventForwarder(KafkaTemplate<String, String> kafkaTemplate,
                               ObjectMapper objectMapper,
                               MeterRegistry meterRegistry,
                               String topicPrefix) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.topicPrefix = topicPrefix;
        this.publishSuccessCounter = Counter.builder("kafka.messages.published")
                .tag("status", "success")
                .description("Events forwarded to Kafka")
                .register(meterRegistry);
        this.publishErrorCounter = Counter.builder("kafka.messages.published")
                .tag("status", "error")
                .description("Events that failed to reach Kafka")
                .register(meterRegistry);
        this.publishTimer = Timer.builder("kafka.publish.duration")
                .description("Time to publish an event to Kafka")
                .register(meterRegistry);
    }

    @Override
    public Set<String> subscribedEventTypes() {
        return Set.of(ALL_EVENTS);
    }

    @Override
    public void handle(RecordedEvent event) {
        forward(event);
    }

    public CompletableFuture<SendResult<String, String>> forward(RecordedEvent event) {
        String topic = topicFor(event.getAggregateType());
        Timer.Sample sample = Timer.start();
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event.getEvent());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize event: insertionId={}, type={}", event.getInsertionId(), event.getEventType(), e);
            publishErrorCounter.increment();
            return CompletableFuture.failedFuture(e);
        }

        ProducerRecord<String, String> record = new ProducerRecord<>(topic, event.getAggregateId(), payload);
        record.headers()
                .add(new RecordHeader("event-type", event.getEventType().getBytes(StandardCharsets.UTF_8)))
                .add(new RecordHeader("insertion-id",
                        String.valueOf(event.getInsertionId()).getBytes(StandardCharsets.UTF_8)));
        if (event.getSequenceNumber() != null) {
            record.headers().add(new RecordHeader("sequence-number",
                    String.valueOf(event.getSequenceNumber()).getBytes(StandardCharsets.UTF_8)));
        }

        return kafkaTemplate.send(record)
                .whenComplete((result, ex) -> {
                    sample.stop(publishTimer);
                    if (ex == null) {
                        publishSuccessCounter.increment();
                        log.debug("Event forwarded: topic={}, aggregateId={}, type={}, partition={}, offset={}",
                                topic, event.getAggregateId(), event.getEventType(),
                                result.getRecordMetadata().partition(),
                                result.getRecordMetadata().offset());
                    } else {
                        publishErrorCounter.increment();
                        log.error("Failed to forward event: topic={}, aggregateId={}, type={}, error={}",
                                topic, event.getAggregateId(), event.getEventType(), ex.getMessage(), ex);
                    }
                });
    }

    String topicFor(String aggregateType) {
        return topicPrefix + aggregateType;
    }
}
