package com.eventledger.core.store;

import com.eventledger.core.aggregate.AggregateRoot;
import com.eventledger.core.aggregate.AggregateType;
import com.eventledger.core.event.AggregateEvent;
import com.eventledger.core.exception.UnhandledEventKindException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON encoding of event payloads and aggregate snapshots.
 */
public class EventCodec {

    private final ObjectMapper objectMapper;

    public EventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Serialize an event after checking the aggregate type declares its kind.
     */
    public String encode(AggregateType<?> aggregateType, AggregateEvent event) {
        if (!aggregateType.handles(event)) {
            throw new UnhandledEventKindException(aggregateType.getName(), event.getEventType());
        }
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize event: type=" + event.getEventType(), e);
        }
    }

    public AggregateEvent decode(AggregateType<?> aggregateType, String eventType, String payload) {
        Class<? extends AggregateEvent> eventClass = aggregateType.eventClass(eventType);
        try {
            return objectMapper.readValue(payload, eventClass);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to deserialize event: type=" + eventType, e);
        }
    }

    public String encodeState(AggregateRoot<?> aggregate) {
        try {
            return objectMapper.writeValueAsString(aggregate);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException(
                    "Failed to serialize aggregate: type=" + aggregate.aggregateType().getName() + ", id=" + aggregate.getId(), e);
        }
    }

    public static class EventSerializationException extends RuntimeException {
        public EventSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
