package com.eventledger.ledger.api;

import com.eventledger.core.event.RecordedEvent;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Wire view of a stored event. The payload is the event itself, serialized by Jackson.
 */
@Data
@Builder
public class EventResponse {

    private long insertionId;
    private String aggregateType;
    private String aggregateId;
    private String eventType;
    private Instant occurredAt;
    private Long sequenceNumber;
    private Instant recordedAt;
    private Instant tombstonedAt;
    private boolean tombstoned;
    private Object payload;

    public static EventResponse of(RecordedEvent recorded) {
        return EventResponse.builder()
                .insertionId(recorded.getInsertionId())
                .aggregateType(recorded.getAggregateType())
                .aggregateId(recorded.getAggregateId())
                .eventType(recorded.getEventType())
                .occurredAt(recorded.getOccurredAt())
                .sequenceNumber(recorded.getSequenceNumber())
                .recordedAt(recorded.getRecordedAt())
                .tombstonedAt(recorded.getTombstonedAt())
                .tombstoned(recorded.isTombstoned())
                .payload(recorded.getEvent())
                .build();
    }
}
