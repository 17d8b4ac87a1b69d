package com.eventledger.core.replay;

import com.eventledger.core.aggregate.AggregateRoot;
import com.eventledger.core.aggregate.AggregateType;
import com.eventledger.core.event.EventPosition;
import com.eventledger.core.event.RecordedEvent;
import com.eventledger.core.exception.NoActiveUnitOfWorkException;
import com.eventledger.core.exception.ReplayInconsistencyException;
import com.eventledger.core.store.AggregateStore;
import com.eventledger.core.store.EventSourcingRegistry;
import com.eventledger.core.store.EventStore;
import com.eventledger.core.uow.UnitOfWork;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable Replay Engine: retroactive edit, delete and backdate.
 *
 * A correction always runs inside one unit of work:
 *
 *   edit     = rewind at (t, seq) + tombstone + process + reapply
 *   delete   = rewind at (t, seq) + tombstone            + reapply
 *   backdate = rewind at t                   + process + reapply
 *
 * Rewind rebuilds each aggregate from the live events strictly before the correction
 * point. Process is the caller's domain logic, applying new events at the point.
 * Reapply loads, unchanged, every live event strictly after the point on top of the
 * corrected state. Downstream events are never rewritten; only the aggregate's
 * projected state changes, and it is persisted through the unit of work.
 */
@Slf4j
public class MutableReplayEngine {

    private final EventSourcingRegistry registry;

    public MutableReplayEngine(EventSourcingRegistry registry) {
        this.registry = registry;
    }

    // ─── Rewind ───────────────────────────────────────────────────────────────

    /**
     * Rewind the aggregates to just before the action (occurredAt, sequenceNumber) and
     * mark the action's own live events for tombstoning.
     *
     * @return reconstructed pre-action aggregates keyed by id; use these, not the inputs
     */
    public <A extends AggregateRoot<A>> Map<String, A> loadEditableAggregatesAtTimeAndPoint(
            Collection<A> aggregates, Instant occurredAt, long sequenceNumber) {
        UnitOfWork unitOfWork = requireUnitOfWork();
        Map<String, A> rewound = identities(aggregates);
        if (rewound.isEmpty()) {
            return rewound;
        }
        EventStore eventStore = eventStoreOf(aggregates);

        for (RecordedEvent recorded : eventStore.eventsForAction(sequenceNumber)) {
            if (recorded.isTombstoned()) {
                continue;
            }
            A owner = rewound.get(recorded.getAggregateId());
            if (owner == null) {
                throw new ReplayInconsistencyException(String.format(
                        "Action %d has a live %s event on %s %s, which is not part of the rewind",
                        sequenceNumber, recorded.getEventType(), eventStore.aggregateType(), recorded.getAggregateId()));
            }
            unitOfWork.tombstone(owner, recorded);
        }

        List<RecordedEvent> history = eventStore.before(rewound.keySet(), occurredAt, sequenceNumber);
        for (RecordedEvent recorded : history) {
            if (recorded.getEvent().belongsTo(sequenceNumber)) {
                throw new ReplayInconsistencyException(String.format(
                        "Event %d of action %d returned as history before the action itself",
                        recorded.getInsertionId(), sequenceNumber));
            }
        }
        Set<String> rebuilt = fold(history, rewound);
        seedUnbuilt(rewound, rebuilt, eventStore, sequenceNumber, unitOfWork);

        rewound.values().forEach(unitOfWork::track);
        log.debug("Rewound to point: aggregateType={}, ids={}, occurredAt={}, sequenceNumber={}, events={}",
                eventStore.aggregateType(), rewound.keySet(), occurredAt, sequenceNumber, history.size());
        return rewound;
    }

    /**
     * Rewind the aggregates to the end of an instant (every live event with
     * occurredAt at or before it), for inserting a brand-new action into the past.
     */
    public <A extends AggregateRoot<A>> Map<String, A> loadEditableAggregatesAtTime(
            Collection<A> aggregates, Instant occurredAt) {
        UnitOfWork unitOfWork = requireUnitOfWork();
        Map<String, A> rewound = identities(aggregates);
        if (rewound.isEmpty()) {
            return rewound;
        }
        EventStore eventStore = eventStoreOf(aggregates);

        List<RecordedEvent> history = eventStore.query(rewound.keySet(), occurredAt);
        Set<String> rebuilt = fold(history, rewound);
        seedUnbuilt(rewound, rebuilt, eventStore, null, unitOfWork);

        rewound.values().forEach(unitOfWork::track);
        log.debug("Rewound to time: aggregateType={}, ids={}, occurredAt={}, events={}",
                eventStore.aggregateType(), rewound.keySet(), occurredAt, history.size());
        return rewound;
    }

    // ─── Reapply ──────────────────────────────────────────────────────────────

    /**
     * Load every live event of the aggregate strictly after (occurredAt, sequenceNumber)
     * on top of its corrected state, then register it with the unit of work.
     */
    public <A extends AggregateRoot<A>> A reapplyDownstreamEventsFrom(A aggregate, Instant occurredAt, long sequenceNumber) {
        UnitOfWork unitOfWork = requireUnitOfWork();
        EventStore eventStore = registry.eventStore(aggregate.aggregateType().getName());
        List<RecordedEvent> downstream = eventStore.after(aggregate.getId(), occurredAt, sequenceNumber);

        EventPosition previous = null;
        int loaded = 0;
        for (RecordedEvent recorded : downstream) {
            verifyLive(recorded);
            if (unitOfWork.isSeeded(aggregate, recorded.getInsertionId())) {
                continue;
            }
            if (!recorded.position().isStrictlyAfter(occurredAt, sequenceNumber)) {
                throw new ReplayInconsistencyException(String.format(
                        "Event %d at %s is not downstream of point (%s, %d)",
                        recorded.getInsertionId(), recorded.getOccurredAt(), occurredAt, sequenceNumber));
            }
            previous = verifyOrder(previous, recorded);
            aggregate.load(recorded.getEvent());
            loaded++;
        }

        unitOfWork.track(aggregate);
        log.debug("Reapplied downstream events: aggregateType={}, id={}, from=({}, {}), events={}",
                eventStore.aggregateType(), aggregate.getId(), occurredAt, sequenceNumber, loaded);
        return aggregate;
    }

    // ─── Read-only Views ──────────────────────────────────────────────────────

    /**
     * Historical, non-persistable states strictly before a point. With a null
     * sequence number the point is the instant itself. Ids with no stored aggregate
     * are omitted. Does not require a unit of work.
     */
    public <A extends AggregateRoot<A>> Map<String, A> loadAggregateStatesBefore(
            AggregateType<A> aggregateType, Collection<String> ids, Instant occurredAt, Long sequenceNumber) {
        AggregateStore<A> store = registry.aggregateStore(aggregateType);
        Map<String, A> views = viewIdentities(store, ids);
        if (views.isEmpty()) {
            return views;
        }
        Set<String> rebuilt = fold(store.eventStore().before(views.keySet(), occurredAt, sequenceNumber), views);
        seedUnbuilt(views, rebuilt, store.eventStore(), sequenceNumber, null);
        return views;
    }

    /**
     * Historical, non-persistable states including every live event up to and
     * including the cutoff.
     */
    public <A extends AggregateRoot<A>> Map<String, A> loadAggregateStatesAt(
            AggregateType<A> aggregateType, Collection<String> ids, Instant cutoff) {
        AggregateStore<A> store = registry.aggregateStore(aggregateType);
        Map<String, A> views = viewIdentities(store, ids);
        if (views.isEmpty()) {
            return views;
        }
        Set<String> rebuilt = fold(store.eventStore().query(views.keySet(), cutoff), views);
        seedUnbuilt(views, rebuilt, store.eventStore(), null, null);
        return views;
    }

    // ─── Internals ────────────────────────────────────────────────────────────

    private <A extends AggregateRoot<A>> Map<String, A> identities(Collection<A> aggregates) {
        Map<String, A> byId = new LinkedHashMap<>();
        for (A aggregate : aggregates) {
            // Not yet persisted: its whole history is in this unit of work already
            A copy = aggregate.isNew() ? aggregate : aggregate.identity();
            if (byId.putIfAbsent(aggregate.getId(), copy) != null) {
                throw new IllegalArgumentException("Aggregate passed twice to rewind: " + aggregate.getId());
            }
        }
        return byId;
    }

    private <A extends AggregateRoot<A>> Map<String, A> viewIdentities(AggregateStore<A> store, Collection<String> ids) {
        Map<String, A> views = new LinkedHashMap<>();
        for (String id : ids) {
            store.currentVersion(id).ifPresent(version ->
                    views.put(id, store.aggregateType().identityOf(id, version).asView()));
        }
        return views;
    }

    private <A extends AggregateRoot<A>> EventStore eventStoreOf(Collection<A> aggregates) {
        String aggregateType = aggregates.iterator().next().aggregateType().getName();
        for (A aggregate : aggregates) {
            if (!aggregate.aggregateType().getName().equals(aggregateType)) {
                throw new IllegalArgumentException("Aggregates of one rewind must share a type: "
                        + aggregateType + ", " + aggregate.aggregateType().getName());
            }
        }
        return registry.eventStore(aggregateType);
    }

    private <A extends AggregateRoot<A>> Set<String> fold(List<RecordedEvent> history, Map<String, A> aggregates) {
        Map<String, EventPosition> lastPositions = new HashMap<>();
        Set<String> rebuilt = new HashSet<>();
        for (RecordedEvent recorded : history) {
            verifyLive(recorded);
            A aggregate = aggregates.get(recorded.getAggregateId());
            if (aggregate == null) {
                throw new ReplayInconsistencyException("Event store returned an event for an unrequested aggregate: "
                        + recorded.getAggregateId());
            }
            lastPositions.put(recorded.getAggregateId(),
                    verifyOrder(lastPositions.get(recorded.getAggregateId()), recorded));
            aggregate.load(recorded.getEvent());
            rebuilt.add(recorded.getAggregateId());
        }
        return rebuilt;
    }

    /**
     * Aggregates with no history before the point start from their first live event
     * (their creation event) so the correction has an identity to apply to. Inside a
     * unit of work the seed is remembered so a later reapply does not load it again.
     */
    private <A extends AggregateRoot<A>> void seedUnbuilt(Map<String, A> aggregates, Set<String> rebuilt,
                                                          EventStore eventStore, Long excludingSequenceNumber,
                                                          UnitOfWork unitOfWork) {
        aggregates.forEach((id, aggregate) -> {
            if (rebuilt.contains(id) || aggregate.isNew()) {
                return;
            }
            eventStore.firstEvent(id, excludingSequenceNumber).ifPresent(first -> {
                verifyLive(first);
                aggregate.load(first.getEvent());
                if (unitOfWork != null) {
                    unitOfWork.markSeeded(aggregate, first.getInsertionId());
                }
                log.debug("Seeded aggregate with its first event: aggregateType={}, id={}, eventType={}",
                        eventStore.aggregateType(), id, first.getEventType());
            });
        });
    }

    private static UnitOfWork requireUnitOfWork() {
        return UnitOfWork.current().orElseThrow(NoActiveUnitOfWorkException::new);
    }

    private static void verifyLive(RecordedEvent recorded) {
        if (recorded.isTombstoned()) {
            log.error("Tombstoned event in replay: aggregateType={}, aggregateId={}, insertionId={}",
                    recorded.getAggregateType(), recorded.getAggregateId(), recorded.getInsertionId());
            throw new ReplayInconsistencyException(String.format("Tombstoned event %d of %s %s appeared in a replay",
                    recorded.getInsertionId(), recorded.getAggregateType(), recorded.getAggregateId()));
        }
    }

    private static EventPosition verifyOrder(EventPosition previous, RecordedEvent recorded) {
        EventPosition current = recorded.position();
        if (previous != null && previous.compareTo(current) > 0) {
            log.error("Out-of-order event in replay: aggregateType={}, aggregateId={}, previous={}, current={}",
                    recorded.getAggregateType(), recorded.getAggregateId(), previous, current);
            throw new ReplayInconsistencyException(String.format(
                    "Event %d of %s %s is out of order: %s after %s", recorded.getInsertionId(),
                    recorded.getAggregateType(), recorded.getAggregateId(), current, previous));
        }
        return current;
    }
}
