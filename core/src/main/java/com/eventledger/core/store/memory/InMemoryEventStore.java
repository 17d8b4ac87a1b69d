package com.eventledger.core.store.memory;

import com.eventledger.core.aggregate.AggregateType;
import com.eventledger.core.event.AggregateEvent;
import com.eventledger.core.event.EventPosition;
import com.eventledger.core.event.RecordedEvent;
import com.eventledger.core.store.EventCodec;
import com.eventledger.core.store.EventStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Process-local event store.
 *
 * Payloads are round-tripped through the codec so decoding behaves exactly like the
 * JPA store. Writes are not transactional: pair with
 * {@code TransactionOperations.withoutTransaction()} for single-process embedding and tests.
 */
public class InMemoryEventStore implements EventStore {

    private final AggregateType<?> aggregateType;
    private final EventCodec codec;
    private final Clock clock;
    private final List<Row> rows = new ArrayList<>();
    private long lastInsertionId;

    public InMemoryEventStore(AggregateType<?> aggregateType, EventCodec codec, Clock clock) {
        this.aggregateType = aggregateType;
        this.codec = codec;
        this.clock = clock;
    }

    @Override
    public String aggregateType() {
        return aggregateType.getName();
    }

    @Override
    public synchronized List<RecordedEvent> append(List<? extends AggregateEvent> events) {
        Instant recordedAt = clock.instant();
        List<RecordedEvent> appended = new ArrayList<>(events.size());
        for (AggregateEvent event : events) {
            Row row = new Row(++lastInsertionId, event.getAggregateId(), event.getEventType(),
                    codec.encode(aggregateType, event), recordedAt, EventPosition.of(event));
            rows.add(row);
            appended.add(RecordedEvent.builder()
                    .insertionId(row.insertionId)
                    .aggregateType(aggregateType.getName())
                    .recordedAt(recordedAt)
                    .event(event)
                    .build());
        }
        return appended;
    }

    @Override
    public List<RecordedEvent> history(Collection<String> aggregateIds) {
        Set<String> ids = new HashSet<>(aggregateIds);
        return select(r -> r.isLive() && ids.contains(r.aggregateId));
    }

    @Override
    public List<RecordedEvent> query(Collection<String> aggregateIds, Instant cutoff) {
        Set<String> ids = new HashSet<>(aggregateIds);
        return select(r -> r.isLive() && ids.contains(r.aggregateId)
                && !r.position.getOccurredAt().isAfter(cutoff));
    }

    @Override
    public List<RecordedEvent> before(Collection<String> aggregateIds, Instant occurredAt, Long sequenceNumber) {
        Set<String> ids = new HashSet<>(aggregateIds);
        Predicate<Row> beforePoint = sequenceNumber == null
                ? r -> r.position.getOccurredAt().isBefore(occurredAt)
                : r -> r.position.isStrictlyBefore(occurredAt, sequenceNumber);
        return select(r -> r.isLive() && ids.contains(r.aggregateId) && beforePoint.test(r));
    }

    @Override
    public List<RecordedEvent> after(String aggregateId, Instant occurredAt, long sequenceNumber) {
        return select(r -> r.isLive() && r.aggregateId.equals(aggregateId)
                && r.position.isStrictlyAfter(occurredAt, sequenceNumber));
    }

    @Override
    public List<RecordedEvent> eventsForAction(long sequenceNumber) {
        Long target = sequenceNumber;
        return select(r -> target.equals(r.position.getSequenceNumber()));
    }

    @Override
    public Optional<RecordedEvent> firstEvent(String aggregateId, Long excludingSequenceNumber) {
        return select(r -> r.isLive() && r.aggregateId.equals(aggregateId)
                && (excludingSequenceNumber == null || !excludingSequenceNumber.equals(r.position.getSequenceNumber())))
                .stream()
                .findFirst();
    }

    @Override
    public List<RecordedEvent> auditTrail(String aggregateId) {
        return select(r -> r.aggregateId.equals(aggregateId));
    }

    @Override
    public synchronized int tombstone(Collection<Long> insertionIds) {
        Instant now = clock.instant();
        int updated = 0;
        for (Row row : rows) {
            if (row.isLive() && insertionIds.contains(row.insertionId)) {
                row.tombstonedAt = now;
                updated++;
            }
        }
        return updated;
    }

    private synchronized List<RecordedEvent> select(Predicate<Row> filter) {
        return rows.stream()
                .filter(filter)
                .sorted(Comparator.comparing(r -> r.position))
                .map(r -> RecordedEvent.builder()
                        .insertionId(r.insertionId)
                        .aggregateType(aggregateType.getName())
                        .recordedAt(r.recordedAt)
                        .tombstonedAt(r.tombstonedAt)
                        .event(codec.decode(aggregateType, r.eventType, r.payload))
                        .build())
                .toList();
    }

    private static final class Row {
        private final long insertionId;
        private final String aggregateId;
        private final String eventType;
        private final String payload;
        private final Instant recordedAt;
        private final EventPosition position;
        private Instant tombstonedAt;

        private Row(long insertionId, String aggregateId, String eventType, String payload,
                    Instant recordedAt, EventPosition unwritten) {
            this.insertionId = insertionId;
            this.aggregateId = aggregateId;
            this.eventType = eventType;
            this.payload = payload;
            this.recordedAt = recordedAt;
            this.position = new EventPosition(unwritten.getOccurredAt(), unwritten.getSequenceNumber(), insertionId);
        }

        private boolean isLive() {
            return tombstonedAt == null;
        }
    }
}
