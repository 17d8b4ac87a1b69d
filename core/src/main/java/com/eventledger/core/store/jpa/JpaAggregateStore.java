package com.eventledger.core.store.jpa;

import com.eventledger.core.aggregate.AggregateRoot;
import com.eventledger.core.aggregate.AggregateType;
import com.eventledger.core.store.AbstractAggregateStore;
import com.eventledger.core.store.EventCodec;
import com.eventledger.core.store.EventStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Aggregate rows in the shared aggregates table, one store per aggregate type.
 */
@Slf4j
public class JpaAggregateStore<A extends AggregateRoot<A>> extends AbstractAggregateStore<A> {

    private final AggregateRecordRepository repository;
    private final Clock clock;

    public JpaAggregateStore(AggregateType<A> aggregateType, EventStore eventStore, EventCodec codec,
                             AggregateRecordRepository repository, Clock clock) {
        super(aggregateType, eventStore, codec);
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    public Optional<Long> currentVersion(String id) {
        return repository.findVersion(aggregateType.getName(), id);
    }

    @Override
    public Optional<String> findSnapshot(String id) {
        return repository.findState(aggregateType.getName(), id);
    }

    @Override
    public List<String> findIdsAfter(String afterId, int limit) {
        PageRequest page = PageRequest.of(0, limit);
        return afterId == null
                ? repository.findFirstIds(aggregateType.getName(), page)
                : repository.findIdsAfter(aggregateType.getName(), afterId, page);
    }

    @Override
    public long count() {
        return repository.countByAggregateType(aggregateType.getName());
    }

    @Override
    protected boolean insert(String id, String state) {
        if (repository.existsById(new AggregateRecord.Key(aggregateType.getName(), id))) {
            return false;
        }
        Instant now = clock.instant();
        try {
            repository.saveAndFlush(AggregateRecord.builder()
                    .aggregateType(aggregateType.getName())
                    .aggregateId(id)
                    .version(1L)
                    .state(state)
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
            return true;
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent insert of aggregate: type={}, id={}", aggregateType.getName(), id);
            return false;
        }
    }

    @Override
    protected boolean compareAndSet(String id, long expectedVersion, String state) {
        return repository.compareAndSet(aggregateType.getName(), id, expectedVersion, state, clock.instant()) == 1;
    }
}
