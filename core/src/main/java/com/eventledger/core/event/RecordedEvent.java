package com.eventledger.core.event;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * An event as it sits in an event store: the decoded event plus the
 * store-assigned insertion id and the audit columns.
 */
@Getter
@Builder
@ToString
public class RecordedEvent {

    private final long insertionId;
    private final String aggregateType;
    private final Instant recordedAt;
    private final Instant tombstonedAt;
    private final AggregateEvent event;

    public String getAggregateId() {
        return event.getAggregateId();
    }

    public String getEventType() {
        return event.getEventType();
    }

    public Instant getOccurredAt() {
        return event.getOccurredAt();
    }

    public Long getSequenceNumber() {
        return event.getSequenceNumber();
    }

    public boolean isTombstoned() {
        return tombstonedAt != null;
    }

    public EventPosition position() {
        return new EventPosition(event.getOccurredAt(), event.getSequenceNumber(), insertionId);
    }
}
