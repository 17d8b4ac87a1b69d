package com.eventledger.core.store;

import com.eventledger.core.event.AggregateEvent;
import com.eventledger.core.event.RecordedEvent;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable, queryable home for one aggregate type's events.
 *
 * Every list is returned in total order: (occurredAt, sequenceNumber nulls first, insertionId).
 * Tombstoned events are excluded unless the method says otherwise.
 * Writes participate in the caller's transaction.
 */
public interface EventStore {

    String aggregateType();

    /**
     * Insert events in the given order, assigning increasing insertion ids.
     */
    List<RecordedEvent> append(List<? extends AggregateEvent> events);

    /**
     * Live events of the aggregates, no cutoff.
     */
    List<RecordedEvent> history(Collection<String> aggregateIds);

    /**
     * Live events with occurredAt at or before the cutoff.
     */
    List<RecordedEvent> query(Collection<String> aggregateIds, Instant cutoff);

    default List<RecordedEvent> query(String aggregateId, Instant cutoff) {
        return query(List.of(aggregateId), cutoff);
    }

    /**
     * Live events strictly before the point (occurredAt, sequenceNumber, +inf).
     * With a null sequence number the point is the instant itself: occurredAt &lt; instant.
     */
    List<RecordedEvent> before(Collection<String> aggregateIds, Instant occurredAt, Long sequenceNumber);

    /**
     * Live events of one aggregate strictly after the point (occurredAt, sequenceNumber).
     */
    List<RecordedEvent> after(String aggregateId, Instant occurredAt, long sequenceNumber);

    /**
     * Events produced by an action, tombstoned ones included and flagged.
     */
    List<RecordedEvent> eventsForAction(long sequenceNumber);

    /**
     * First live event of an aggregate, skipping events of the given action when not null.
     */
    Optional<RecordedEvent> firstEvent(String aggregateId, Long excludingSequenceNumber);

    /**
     * Every event of the aggregate, tombstoned ones included.
     */
    List<RecordedEvent> auditTrail(String aggregateId);

    /**
     * Logically delete events. Already tombstoned events are left untouched.
     *
     * @return number of events newly tombstoned
     */
    int tombstone(Collection<Long> insertionIds);
}
