package com.eventledger.core.event;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * Total-order key of an event: (occurredAt ASC, sequenceNumber ASC NULLS FIRST, insertionId ASC).
 *
 * Un-sequenced events at the same instant sort before sequenced ones. The insertion id
 * is only a final tie-breaker; an event not yet written (null insertion id) sorts after
 * every written event with the same time and sequence number.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class EventPosition implements Comparable<EventPosition> {

    public static final Comparator<EventPosition> ORDER = Comparator
            .comparing(EventPosition::getOccurredAt)
            .thenComparing(EventPosition::getSequenceNumber, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(EventPosition::getInsertionId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final Instant occurredAt;
    private final Long sequenceNumber;
    private final Long insertionId;

    public EventPosition(Instant occurredAt, Long sequenceNumber, Long insertionId) {
        this.occurredAt = Objects.requireNonNull(occurredAt, "occurredAt");
        this.sequenceNumber = sequenceNumber;
        this.insertionId = insertionId;
    }

    public static EventPosition of(AggregateEvent event) {
        return new EventPosition(event.getOccurredAt(), event.getSequenceNumber(), null);
    }

    /**
     * Strictly before the point (occurredAt, sequenceNumber, +inf).
     * Un-sequenced events at the same instant are before every point at that instant.
     */
    public boolean isStrictlyBefore(Instant pointTime, long pointSequence) {
        int byTime = occurredAt.compareTo(pointTime);
        if (byTime != 0) {
            return byTime < 0;
        }
        return sequenceNumber == null || sequenceNumber < pointSequence;
    }

    /**
     * Strictly after the point: later instant, or same instant with a greater sequence number.
     */
    public boolean isStrictlyAfter(Instant pointTime, long pointSequence) {
        int byTime = occurredAt.compareTo(pointTime);
        if (byTime != 0) {
            return byTime > 0;
        }
        return sequenceNumber != null && sequenceNumber > pointSequence;
    }

    @Override
    public int compareTo(EventPosition other) {
        return ORDER.compare(this, other);
    }
}
