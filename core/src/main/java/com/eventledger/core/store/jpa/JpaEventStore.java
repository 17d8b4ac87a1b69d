package com.eventledger.core.store.jpa;

import com.eventledger.core.aggregate.AggregateType;
import com.eventledger.core.event.AggregateEvent;
import com.eventledger.core.event.RecordedEvent;
import com.eventledger.core.store.EventCodec;
import com.eventledger.core.store.EventStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Event store for one aggregate type, backed by the shared aggregate_events table.
 *
 * Appends rely on the identity column for insertion ids, so rows written in one call
 * receive increasing ids in list order. Must be called within an active transaction
 * for writes (the unit of work provides one).
 */
@Slf4j
public class JpaEventStore implements EventStore {

    private static final PageRequest FIRST = PageRequest.of(0, 1);

    private final AggregateType<?> aggregateType;
    private final StoredEventRepository repository;
    private final EventCodec codec;
    private final Clock clock;

    public JpaEventStore(AggregateType<?> aggregateType, StoredEventRepository repository,
                         EventCodec codec, Clock clock) {
        this.aggregateType = aggregateType;
        this.repository = repository;
        this.codec = codec;
        this.clock = clock;
    }

    @Override
    public String aggregateType() {
        return aggregateType.getName();
    }

    @Override
    public List<RecordedEvent> append(List<? extends AggregateEvent> events) {
        Instant recordedAt = clock.instant();
        List<RecordedEvent> appended = new ArrayList<>(events.size());
        for (AggregateEvent event : events) {
            StoredEvent record = StoredEvent.builder()
                    .aggregateType(aggregateType.getName())
                    .aggregateId(event.getAggregateId())
                    .eventType(event.getEventType())
                    .occurredAt(event.getOccurredAt())
                    .sequenceNumber(event.getSequenceNumber())
                    .payload(codec.encode(aggregateType, event))
                    .recordedAt(recordedAt)
                    .build();
            StoredEvent saved = repository.save(record);
            appended.add(RecordedEvent.builder()
                    .insertionId(saved.getInsertionId())
                    .aggregateType(aggregateType.getName())
                    .recordedAt(recordedAt)
                    .event(event)
                    .build());
        }
        log.debug("Events appended: aggregateType={}, count={}", aggregateType.getName(), appended.size());
        return appended;
    }

    @Override
    public List<RecordedEvent> history(Collection<String> aggregateIds) {
        if (aggregateIds.isEmpty()) {
            return List.of();
        }
        return decode(repository.findLive(aggregateType.getName(), aggregateIds));
    }

    @Override
    public List<RecordedEvent> query(Collection<String> aggregateIds, Instant cutoff) {
        if (aggregateIds.isEmpty()) {
            return List.of();
        }
        return decode(repository.findLiveUpTo(aggregateType.getName(), aggregateIds, cutoff));
    }

    @Override
    public List<RecordedEvent> before(Collection<String> aggregateIds, Instant occurredAt, Long sequenceNumber) {
        if (aggregateIds.isEmpty()) {
            return List.of();
        }
        List<StoredEvent> rows = sequenceNumber == null
                ? repository.findLiveBeforeTime(aggregateType.getName(), aggregateIds, occurredAt)
                : repository.findLiveBeforePoint(aggregateType.getName(), aggregateIds, occurredAt, sequenceNumber);
        return decode(rows);
    }

    @Override
    public List<RecordedEvent> after(String aggregateId, Instant occurredAt, long sequenceNumber) {
        return decode(repository.findLiveAfterPoint(aggregateType.getName(), aggregateId, occurredAt, sequenceNumber));
    }

    @Override
    public List<RecordedEvent> eventsForAction(long sequenceNumber) {
        return decode(repository.findByAction(aggregateType.getName(), sequenceNumber));
    }

    @Override
    public Optional<RecordedEvent> firstEvent(String aggregateId, Long excludingSequenceNumber) {
        List<StoredEvent> rows = excludingSequenceNumber == null
                ? repository.findLiveHead(aggregateType.getName(), aggregateId, FIRST)
                : repository.findLiveHeadExcluding(aggregateType.getName(), aggregateId, excludingSequenceNumber, FIRST);
        return decode(rows).stream().findFirst();
    }

    @Override
    public List<RecordedEvent> auditTrail(String aggregateId) {
        return decode(repository.findAuditTrail(aggregateType.getName(), aggregateId));
    }

    @Override
    public int tombstone(Collection<Long> insertionIds) {
        if (insertionIds.isEmpty()) {
            return 0;
        }
        int updated = repository.tombstone(aggregateType.getName(), insertionIds, clock.instant());
        log.debug("Events tombstoned: aggregateType={}, requested={}, updated={}",
                aggregateType.getName(), insertionIds.size(), updated);
        return updated;
    }

    private List<RecordedEvent> decode(List<StoredEvent> rows) {
        return rows.stream()
                .map(r -> RecordedEvent.builder()
                        .insertionId(r.getInsertionId())
                        .aggregateType(r.getAggregateType())
                        .recordedAt(r.getRecordedAt())
                        .tombstonedAt(r.getTombstonedAt())
                        .event(codec.decode(aggregateType, r.getEventType(), r.getPayload()))
                        .build())
                .toList();
    }
}
