package com.eventledger.core.store;

import com.eventledger.core.aggregate.AggregateRoot;
import com.eventledger.core.aggregate.AggregateType;
import com.eventledger.core.event.RecordedEvent;
import com.eventledger.core.exception.CannotPersistAggregateViewException;
import com.eventledger.core.exception.VersionConflictException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Shared persist/find logic. Subclasses supply the two storage primitives:
 * insert-if-absent and compare-and-set.
 */
@Slf4j
public abstract class AbstractAggregateStore<A extends AggregateRoot<A>> implements AggregateStore<A> {

    protected final AggregateType<A> aggregateType;
    protected final EventStore eventStore;
    protected final EventCodec codec;

    protected AbstractAggregateStore(AggregateType<A> aggregateType, EventStore eventStore, EventCodec codec) {
        if (!aggregateType.getName().equals(eventStore.aggregateType())) {
            throw new IllegalArgumentException(String.format("Event store for %s cannot back aggregate type %s",
                    eventStore.aggregateType(), aggregateType.getName()));
        }
        this.aggregateType = aggregateType;
        this.eventStore = eventStore;
        this.codec = codec;
    }

    @Override
    public AggregateType<A> aggregateType() {
        return aggregateType;
    }

    @Override
    public EventStore eventStore() {
        return eventStore;
    }

    @Override
    public Optional<A> find(String id) {
        return currentVersion(id).map(version -> {
            A aggregate = aggregateType.identityOf(id, version);
            for (RecordedEvent recorded : eventStore.history(List.of(id))) {
                aggregate.load(recorded.getEvent());
            }
            return aggregate;
        });
    }

    @Override
    public void persist(A aggregate) {
        if (aggregate.isView()) {
            throw new CannotPersistAggregateViewException(aggregateType.getName(), aggregate.getId());
        }
        if (aggregate.getId() == null) {
            throw new IllegalStateException("Cannot persist " + aggregateType.getName() + " without an id");
        }
        boolean isNew = aggregate.isNew();
        long expected = aggregate.getVersion();

        // The snapshot carries the version the row will hold after the write
        aggregate.markPersisted(expected + 1);
        boolean written = false;
        try {
            String state = codec.encodeState(aggregate);
            written = isNew ? insert(aggregate.getId(), state) : compareAndSet(aggregate.getId(), expected, state);
        } finally {
            if (!written) {
                aggregate.markPersisted(expected);
            }
        }
        if (!written) {
            throw new VersionConflictException(aggregateType.getName(), aggregate.getId(), expected);
        }
        log.debug("Aggregate persisted: type={}, id={}, version={}",
                aggregateType.getName(), aggregate.getId(), aggregate.getVersion());
    }

    @Override
    public void verifyVersion(A aggregate) {
        if (aggregate.isView()) {
            throw new CannotPersistAggregateViewException(aggregateType.getName(), aggregate.getId());
        }
        Optional<Long> stored = currentVersion(aggregate.getId());
        if (aggregate.isNew() ? stored.isPresent() : !stored.equals(Optional.of(aggregate.getVersion()))) {
            log.warn("Stale aggregate detected before flush: type={}, id={}, loadedVersion={}, storedVersion={}",
                    aggregateType.getName(), aggregate.getId(), aggregate.getVersion(), stored.orElse(null));
            throw new VersionConflictException(aggregateType.getName(), aggregate.getId(), aggregate.getVersion());
        }
    }

    /**
     * @return false when a row with this id already exists
     */
    protected abstract boolean insert(String id, String state);

    /**
     * Atomically write state and version + 1 where version == expectedVersion.
     *
     * @return false when no row matched
     */
    protected abstract boolean compareAndSet(String id, long expectedVersion, String state);
}
