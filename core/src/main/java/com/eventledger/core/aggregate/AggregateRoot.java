package com.eventledger.core.aggregate;

import com.eventledger.core.event.AggregateEvent;
import com.eventledger.core.exception.NoActiveUnitOfWorkException;
import com.eventledger.core.exception.VersionConflictException;
import com.eventledger.core.uow.UnitOfWork;
import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Base class of every event-sourced aggregate.
 *
 * State changes flow through two entry points with identical dispatch:
 *  - apply(event): write path. Mutates state and registers the event and this aggregate
 *    with the unit of work bound to the current thread.
 *  - load(event):  read path. Pure fold, never touches the unit of work; safe to call
 *    repeatedly to rebuild any prefix of history.
 *
 * Handlers are looked up in the {@link AggregateType} table, so handlers must be pure
 * functions of (current state, event payload).
 *
 * The version counts persisted state transitions and is the compare-and-swap token
 * used by {@code AggregateStore.persist}. A new aggregate has version 0.
 */
public abstract class AggregateRoot<A extends AggregateRoot<A>> {

    private String id;
    private long version;
    private boolean view;

    public abstract AggregateType<A> aggregateType();

    public String getId() {
        return id;
    }

    public long getVersion() {
        return version;
    }

    @JsonIgnore
    public boolean isNew() {
        return version == 0;
    }

    /**
     * True for read-only historical states produced by the replay engine.
     */
    @JsonIgnore
    public boolean isView() {
        return view;
    }

    protected void assignId(String id) {
        this.id = id;
    }

    protected final void apply(AggregateEvent event) {
        UnitOfWork unitOfWork = UnitOfWork.current().orElseThrow(NoActiveUnitOfWorkException::new);
        load(event);
        unitOfWork.record(this, event);
    }

    public final A load(AggregateEvent event) {
        A self = self();
        aggregateType().dispatch(self, event);
        return self;
    }

    public final A loadAll(Iterable<? extends AggregateEvent> events) {
        for (AggregateEvent event : events) {
            load(event);
        }
        return self();
    }

    /**
     * Fail fast when the caller's expected version is stale. Does not replace the
     * conditional update performed on persist.
     */
    public void confirmVersion(long expectedVersion) {
        if (expectedVersion != version) {
            throw new VersionConflictException(aggregateType().getName(), id, expectedVersion, version);
        }
    }

    /**
     * Blank copy with the same identity and version, ready for a fold.
     */
    public A identity() {
        return aggregateType().identityOf(id, version);
    }

    public A asView() {
        this.view = true;
        return self();
    }

    /**
     * Called by aggregate stores after a successful write.
     */
    public void markPersisted(long newVersion) {
        this.version = newVersion;
    }

    void restoreIdentity(String id, long version) {
        this.id = id;
        this.version = version;
    }

    /**
     * This aggregate as its concrete type.
     */
    @SuppressWarnings("unchecked")
    public final A self() {
        return (A) this;
    }
}
