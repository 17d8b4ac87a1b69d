package com.eventledger.core.uow;

import com.eventledger.core.aggregate.AggregateRoot;
import com.eventledger.core.event.AggregateEvent;
import com.eventledger.core.event.RecordedEvent;
import com.eventledger.core.store.EventSourcingRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Unit of Work: buffers for one logical operation.
 *
 * Holds, in generation order, every event applied inside the scope, the latest
 * in-memory snapshot of each touched aggregate (later snapshots replace earlier ones),
 * and the insertion ids marked for tombstoning. Nothing reaches storage until
 * {@link UnitOfWorkManager} flushes the buffers inside its transaction.
 *
 * The active instance is bound to the current thread by the manager; aggregates find it
 * through {@link #current()}.
 */
@Slf4j
public class UnitOfWork {

    private static final ThreadLocal<UnitOfWork> CURRENT = new ThreadLocal<>();

    private final String id = UUID.randomUUID().toString().substring(0, 8);
    private final List<PendingEvent> events = new ArrayList<>();
    private final Map<String, AggregateRoot<?>> aggregates = new LinkedHashMap<>();
    private final Map<String, Set<Long>> tombstones = new LinkedHashMap<>();
    private final Set<String> seeded = new HashSet<>();
    private boolean closed;

    public static Optional<UnitOfWork> current() {
        return Optional.ofNullable(CURRENT.get());
    }

    static void bind(UnitOfWork unitOfWork) {
        CURRENT.set(unitOfWork);
    }

    static void unbind() {
        CURRENT.remove();
    }

    public String getId() {
        return id;
    }

    // ─── Buffering ────────────────────────────────────────────────────────────

    /**
     * Called by AggregateRoot.apply after the handler ran.
     */
    public void record(AggregateRoot<?> aggregate, AggregateEvent event) {
        ensureOpen();
        track(aggregate);
        events.add(new PendingEvent(aggregate.aggregateType().getName(), event));
    }

    /**
     * Register an aggregate snapshot for persistence without a new event, e.g. after
     * a rewind and downstream reapply.
     */
    public void track(AggregateRoot<?> aggregate) {
        ensureOpen();
        if (aggregate.getId() == null) {
            throw new IllegalStateException("Cannot track a " + aggregate.aggregateType().getName() + " without an id");
        }
        aggregates.put(keyOf(aggregate), aggregate);
    }

    /**
     * Mark a stored event of the aggregate for tombstoning at commit.
     */
    public void tombstone(AggregateRoot<?> aggregate, RecordedEvent event) {
        ensureOpen();
        track(aggregate);
        tombstones.computeIfAbsent(event.getAggregateType(), t -> new LinkedHashSet<>()).add(event.getInsertionId());
    }

    /**
     * Remember that a rewind seeded the aggregate with this stored event, so a downstream
     * reapply in the same scope skips it.
     */
    public void markSeeded(AggregateRoot<?> aggregate, long insertionId) {
        ensureOpen();
        seeded.add(keyOf(aggregate) + "#" + insertionId);
    }

    public boolean isSeeded(AggregateRoot<?> aggregate, long insertionId) {
        return seeded.contains(keyOf(aggregate) + "#" + insertionId);
    }

    public List<AggregateEvent> pendingEvents() {
        return events.stream().map(PendingEvent::getEvent).collect(Collectors.toList());
    }

    public Collection<AggregateRoot<?>> trackedAggregates() {
        return Collections.unmodifiableCollection(aggregates.values());
    }

    public Set<Long> pendingTombstones(String aggregateType) {
        return Collections.unmodifiableSet(tombstones.getOrDefault(aggregateType, Set.of()));
    }

    // ─── Commit / Discard ─────────────────────────────────────────────────────

    /**
     * Write the buffers through the stores. Must run inside the storage transaction.
     *
     *  1. check every tracked aggregate's version, so a stale one fails before any write
     *  2. tombstone superseded events
     *  3. append events, in generation order, to their aggregate type's event store
     *  4. persist every tracked aggregate (compare-and-swap on version)
     *
     * @return appended events with their insertion ids, in generation order
     */
    List<RecordedEvent> flush(EventSourcingRegistry registry) {
        ensureOpen();
        for (AggregateRoot<?> aggregate : aggregates.values()) {
            registry.verifyVersion(aggregate);
        }

        tombstones.forEach((aggregateType, insertionIds) -> {
            int updated = registry.eventStore(aggregateType).tombstone(insertionIds);
            if (updated != insertionIds.size()) {
                log.warn("Some events were already tombstoned: unitOfWork={}, aggregateType={}, requested={}, updated={}",
                        id, aggregateType, insertionIds.size(), updated);
            }
        });

        List<RecordedEvent> appended = new ArrayList<>(events.size());
        int start = 0;
        while (start < events.size()) {
            String aggregateType = events.get(start).getAggregateType();
            int end = start;
            List<AggregateEvent> run = new ArrayList<>();
            while (end < events.size() && events.get(end).getAggregateType().equals(aggregateType)) {
                run.add(events.get(end).getEvent());
                end++;
            }
            appended.addAll(registry.eventStore(aggregateType).append(run));
            start = end;
        }

        for (AggregateRoot<?> aggregate : aggregates.values()) {
            registry.persist(aggregate);
        }

        log.debug("Unit of work flushed: unitOfWork={}, aggregates={}, events={}, tombstones={}",
                id, aggregates.size(), appended.size(), tombstones.values().stream().mapToInt(Set::size).sum());
        return appended;
    }

    void discard() {
        events.clear();
        aggregates.clear();
        tombstones.clear();
        seeded.clear();
        closed = true;
    }

    void close() {
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Unit of work " + id + " is closed");
        }
    }

    private static String keyOf(AggregateRoot<?> aggregate) {
        return aggregate.aggregateType().getName() + "/" + aggregate.getId();
    }

    private static final class PendingEvent {
        private final String aggregateType;
        private final AggregateEvent event;

        private PendingEvent(String aggregateType, AggregateEvent event) {
            this.aggregateType = aggregateType;
            this.event = event;
        }

        String getAggregateType() {
            return aggregateType;
        }

        AggregateEvent getEvent() {
            return event;
        }
    }
}
