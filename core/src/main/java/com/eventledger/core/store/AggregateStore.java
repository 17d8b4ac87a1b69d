package com.eventledger.core.store;

import com.eventledger.core.aggregate.AggregateRoot;
import com.eventledger.core.aggregate.AggregateType;

import java.util.List;
import java.util.Optional;

/**
 * Current-state rows of one aggregate type, written with compare-and-swap on (id, version).
 */
public interface AggregateStore<A extends AggregateRoot<A>> {

    AggregateType<A> aggregateType();

    EventStore eventStore();

    /**
     * Aggregate rebuilt from its live events at the stored version.
     */
    Optional<A> find(String id);

    Optional<Long> currentVersion(String id);

    /**
     * Stored JSON snapshot of the aggregate, as written on its last persist.
     */
    Optional<String> findSnapshot(String id);

    /**
     * Insert a new aggregate at version 1, or advance an existing one from the version it
     * was loaded with to version + 1.
     *
     * @throws com.eventledger.core.exception.VersionConflictException when the stored version moved
     * @throws com.eventledger.core.exception.CannotPersistAggregateViewException for read-only views
     */
    void persist(A aggregate);

    /**
     * Check, without writing, that {@link #persist} would find the version the aggregate
     * was loaded with: no row for a new aggregate, the same version for an existing one.
     *
     * @throws com.eventledger.core.exception.VersionConflictException when the stored version moved
     */
    void verifyVersion(A aggregate);

    /**
     * Ids in ascending order after the cursor; a null cursor starts from the beginning.
     */
    List<String> findIdsAfter(String afterId, int limit);

    long count();
}
