package com.eventledger.core.store.memory;

import com.eventledger.core.aggregate.AggregateRoot;
import com.eventledger.core.aggregate.AggregateType;
import com.eventledger.core.store.AbstractAggregateStore;
import com.eventledger.core.store.EventCodec;
import com.eventledger.core.store.EventStore;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local aggregate rows. Compare-and-set is atomic per id; there is no
 * rollback across ids, see {@link InMemoryEventStore}.
 */
public class InMemoryAggregateStore<A extends AggregateRoot<A>> extends AbstractAggregateStore<A> {

    private final ConcurrentSkipListMap<String, Snapshot> rows = new ConcurrentSkipListMap<>();

    public InMemoryAggregateStore(AggregateType<A> aggregateType, EventStore eventStore, EventCodec codec) {
        super(aggregateType, eventStore, codec);
    }

    @Override
    public Optional<Long> currentVersion(String id) {
        return Optional.ofNullable(rows.get(id)).map(s -> s.version);
    }

    @Override
    public Optional<String> findSnapshot(String id) {
        return Optional.ofNullable(rows.get(id)).map(s -> s.state);
    }

    @Override
    public List<String> findIdsAfter(String afterId, int limit) {
        var tail = afterId == null ? rows : rows.tailMap(afterId, false);
        return tail.keySet().stream().limit(limit).toList();
    }

    @Override
    public long count() {
        return rows.size();
    }

    @Override
    protected boolean insert(String id, String state) {
        return rows.putIfAbsent(id, new Snapshot(1L, state)) == null;
    }

    @Override
    protected boolean compareAndSet(String id, long expectedVersion, String state) {
        AtomicBoolean swapped = new AtomicBoolean(false);
        rows.computeIfPresent(id, (key, current) -> {
            if (current.version != expectedVersion) {
                return current;
            }
            swapped.set(true);
            return new Snapshot(expectedVersion + 1, state);
        });
        return swapped.get();
    }

    private static final class Snapshot {
        private final long version;
        private final String state;

        private Snapshot(long version, String state) {
            this.version = version;
            this.state = state;
        }
    }
}
