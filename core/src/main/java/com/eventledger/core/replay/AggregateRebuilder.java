package com.eventledger.core.replay;

import com.eventledger.core.aggregate.AggregateRoot;
import com.eventledger.core.event.RecordedEvent;
import com.eventledger.core.store.AggregateStore;
import com.eventledger.core.store.EventSourcingRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.support.TransactionOperations;

import java.util.List;
import java.util.function.Consumer;

/**
 * Recomputes stored aggregate rows from their live events.
 *
 * Walks the ids of one aggregate type with a cursor, one transaction per chunk. Each
 * aggregate is folded from scratch onto its identity and written back with the usual
 * compare-and-swap, so a rebuild racing a live write fails that chunk with a
 * VersionConflict instead of overwriting newer state.
 */
@Slf4j
public class AggregateRebuilder {

    private final EventSourcingRegistry registry;
    private final TransactionOperations transactionOperations;

    public AggregateRebuilder(EventSourcingRegistry registry, TransactionOperations transactionOperations) {
        this.registry = registry;
        this.transactionOperations = transactionOperations;
    }

    public RebuildReport rebuild(String aggregateType, int chunkSize) {
        return rebuild(aggregateType, chunkSize, chunk -> { });
    }

    /**
     * @param onChunk called after each committed chunk with the ids it rebuilt
     */
    public RebuildReport rebuild(String aggregateType, int chunkSize, Consumer<List<String>> onChunk) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        AggregateStore<?> store = registry.aggregateStore(aggregateType);
        long total = store.count();
        log.info("Rebuild started: aggregateType={}, aggregates={}, chunkSize={}", aggregateType, total, chunkSize);

        int chunks = 0;
        long rebuilt = 0;
        String cursor = null;
        while (true) {
            List<String> ids = store.findIdsAfter(cursor, chunkSize);
            if (ids.isEmpty()) {
                break;
            }
            transactionOperations.executeWithoutResult(status -> ids.forEach(id -> rebuildOne(store, id)));
            chunks++;
            rebuilt += ids.size();
            cursor = ids.get(ids.size() - 1);
            onChunk.accept(ids);
            log.info("Rebuilt chunk: aggregateType={}, chunk={}, progress={}/{}", aggregateType, chunks, rebuilt, total);
        }

        log.info("Rebuild finished: aggregateType={}, aggregates={}, chunks={}", aggregateType, rebuilt, chunks);
        return new RebuildReport(aggregateType, rebuilt, chunks);
    }

    private <A extends AggregateRoot<A>> void rebuildOne(AggregateStore<A> store, String id) {
        store.currentVersion(id).ifPresent(version -> {
            A aggregate = store.aggregateType().identityOf(id, version);
            for (RecordedEvent recorded : store.eventStore().history(List.of(id))) {
                aggregate.load(recorded.getEvent());
            }
            store.persist(aggregate);
        });
    }
}
