package com.eventledger.core.aggregate;

import com.eventledger.core.event.AggregateEvent;
import com.eventledger.core.exception.UnhandledEventKindException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

/**
 * Aggregate Type: explicit handler table for one kind of aggregate.
 *
 * Maps each event kind to:
 *  - the concrete event class (used to decode stored payloads)
 *  - a state-transition function (used by apply and load)
 *
 * The table is built once, usually as a static constant on the aggregate class:
 *
 * <pre>
 * public static final AggregateType&lt;Account&gt; TYPE = AggregateType.builder("account", Account::new)
 *         .on(AccountOpened.TYPE, AccountOpened.class, Account::onOpened)
 *         .on(FundsDeposited.TYPE, FundsDeposited.class, Account::onDeposited)
 *         .build();
 * </pre>
 *
 * Handler signatures are checked by the compiler; duplicate kinds or classes are
 * rejected when the table is built.
 */
public final class AggregateType<A extends AggregateRoot<A>> {

    private final String name;
    private final Supplier<A> factory;
    private final Map<String, Registration<A>> registrations;

    private AggregateType(String name, Supplier<A> factory, Map<String, Registration<A>> registrations) {
        this.name = name;
        this.factory = factory;
        this.registrations = Collections.unmodifiableMap(registrations);
    }

    public static <A extends AggregateRoot<A>> Builder<A> builder(String name, Supplier<A> factory) {
        return new Builder<>(name, factory);
    }

    public String getName() {
        return name;
    }

    public Set<String> eventTypes() {
        return registrations.keySet();
    }

    public A newInstance() {
        return factory.get();
    }

    /**
     * Blank aggregate carrying only identity and the stored version.
     * Folding events onto it reconstructs state without touching the unit of work.
     */
    public A identityOf(String id, long version) {
        A aggregate = factory.get();
        aggregate.restoreIdentity(id, version);
        return aggregate;
    }

    public Class<? extends AggregateEvent> eventClass(String eventType) {
        Registration<A> registration = registrations.get(eventType);
        if (registration == null) {
            throw new UnhandledEventKindException(name, eventType);
        }
        return registration.eventClass;
    }

    public boolean handles(AggregateEvent event) {
        Registration<A> registration = registrations.get(event.getEventType());
        return registration != null && registration.eventClass == event.getClass();
    }

    void dispatch(A aggregate, AggregateEvent event) {
        Registration<A> registration = registrations.get(event.getEventType());
        if (registration == null || registration.eventClass != event.getClass()) {
            throw new UnhandledEventKindException(name, event.getEventType());
        }
        registration.handler.accept(aggregate, event);
    }

    @Override
    public String toString() {
        return "AggregateType[" + name + ", events=" + registrations.keySet() + "]";
    }

    private static final class Registration<A> {
        private final Class<? extends AggregateEvent> eventClass;
        private final BiConsumer<A, AggregateEvent> handler;

        private Registration(Class<? extends AggregateEvent> eventClass, BiConsumer<A, AggregateEvent> handler) {
            this.eventClass = eventClass;
            this.handler = handler;
        }
    }

    public static final class Builder<A extends AggregateRoot<A>> {

        private final String name;
        private final Supplier<A> factory;
        private final Map<String, Registration<A>> registrations = new LinkedHashMap<>();

        private Builder(String name, Supplier<A> factory) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Aggregate type name is required");
            }
            this.name = name;
            this.factory = Objects.requireNonNull(factory, "factory");
        }

        public <E extends AggregateEvent> Builder<A> on(String eventType, Class<E> eventClass,
                                                        BiConsumer<A, ? super E> handler) {
            Objects.requireNonNull(eventType, "eventType");
            Objects.requireNonNull(eventClass, "eventClass");
            Objects.requireNonNull(handler, "handler");
            if (registrations.containsKey(eventType)) {
                throw new IllegalStateException(
                        String.format("Duplicate handler for event kind %s on aggregate type %s", eventType, name));
            }
            boolean classTaken = registrations.values().stream().anyMatch(r -> r.eventClass == eventClass);
            if (classTaken) {
                throw new IllegalStateException(
                        String.format("Event class %s registered twice on aggregate type %s", eventClass.getName(), name));
            }
            registrations.put(eventType, new Registration<>(eventClass,
                    (aggregate, event) -> handler.accept(aggregate, eventClass.cast(event))));
            return this;
        }

        public AggregateType<A> build() {
            if (registrations.isEmpty()) {
                throw new IllegalStateException("Aggregate type " + name + " declares no event handlers");
            }
            return new AggregateType<>(name, factory, new LinkedHashMap<>(registrations));
        }
    }
}
