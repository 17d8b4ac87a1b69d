package com.eventledger.core.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;

/**
 * Base class for every event recorded against an aggregate.
 *
 * Every event carries:
 *  - eventType:      Dot-notation kind tag, unique per concrete class, e.g. "account.funds-deposited"
 *  - aggregateId:    The aggregate the fact is about
 *  - occurredAt:     When the fact is effective (may be earlier or later than recording time)
 *  - sequenceNumber: Id of the Action that produced the event, or null when the event can never be edited
 *
 * Payload fields live in subclasses. Subclasses are immutable and declare a
 * {@code @JsonCreator} constructor so stored payloads can be decoded.
 * The insertion id is assigned by the store and lives on {@link RecordedEvent}.
 */
@Getter
@ToString
@JsonIgnoreProperties(value = "eventType", allowGetters = true, ignoreUnknown = true)
public abstract class AggregateEvent {

    private final String eventType;
    private final String aggregateId;
    private final Instant occurredAt;
    private final Long sequenceNumber;

    protected AggregateEvent(String eventType, String aggregateId, Instant occurredAt, Long sequenceNumber) {
        this.eventType = Objects.requireNonNull(eventType, "eventType");
        this.aggregateId = Objects.requireNonNull(aggregateId, "aggregateId");
        this.occurredAt = Objects.requireNonNull(occurredAt, "occurredAt");
        this.sequenceNumber = sequenceNumber;
    }

    /**
     * True when the event was produced by an Action and can be targeted by edit or delete.
     */
    @JsonIgnore
    public boolean isSequenced() {
        return sequenceNumber != null;
    }

    public boolean belongsTo(long actionSequenceNumber) {
        return sequenceNumber != null && sequenceNumber == actionSequenceNumber;
    }
}
