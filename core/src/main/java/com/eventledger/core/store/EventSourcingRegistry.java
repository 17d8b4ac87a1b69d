package com.eventledger.core.store;

import com.eventledger.core.aggregate.AggregateRoot;
import com.eventledger.core.aggregate.AggregateType;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Lookup of the stores backing each registered aggregate type.
 */
@Slf4j
public class EventSourcingRegistry {

    private final Map<String, AggregateStore<?>> stores;

    public EventSourcingRegistry(Collection<? extends AggregateStore<?>> aggregateStores) {
        Map<String, AggregateStore<?>> byType = new LinkedHashMap<>();
        for (AggregateStore<?> store : aggregateStores) {
            String name = store.aggregateType().getName();
            if (byType.putIfAbsent(name, store) != null) {
                throw new IllegalStateException("Aggregate type registered twice: " + name);
            }
        }
        this.stores = Collections.unmodifiableMap(byType);
        log.info("Event sourcing registry initialized: aggregateTypes={}", stores.keySet());
    }

    public Set<String> aggregateTypes() {
        return stores.keySet();
    }

    public EventStore eventStore(String aggregateType) {
        return aggregateStore(aggregateType).eventStore();
    }

    public AggregateStore<?> aggregateStore(String aggregateType) {
        AggregateStore<?> store = stores.get(aggregateType);
        if (store == null) {
            throw new IllegalArgumentException("No stores registered for aggregate type: " + aggregateType);
        }
        return store;
    }

    @SuppressWarnings("unchecked")
    public <A extends AggregateRoot<A>> AggregateStore<A> aggregateStore(AggregateType<A> aggregateType) {
        return (AggregateStore<A>) aggregateStore(aggregateType.getName());
    }

    public void persist(AggregateRoot<?> aggregate) {
        persistTyped(aggregate);
    }

    public void verifyVersion(AggregateRoot<?> aggregate) {
        verifyTyped(aggregate);
    }

    private <A extends AggregateRoot<A>> void persistTyped(AggregateRoot<A> aggregate) {
        A typed = aggregate.self();
        aggregateStore(typed.aggregateType()).persist(typed);
    }

    private <A extends AggregateRoot<A>> void verifyTyped(AggregateRoot<A> aggregate) {
        A typed = aggregate.self();
        aggregateStore(typed.aggregateType()).verifyVersion(typed);
    }
}
