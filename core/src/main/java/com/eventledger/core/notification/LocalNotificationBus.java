package com.eventledger.core.notification;

import com.eventledger.core.event.RecordedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-process notification bus.
 *
 * Builds a registration table (event kind → subscribers) from the subscriber beans
 * at startup and dispatches each committed event to the subscribers of its kind plus
 * the wildcard subscribers. A failing subscriber is logged and counted; the remaining
 * subscribers still receive the event.
 */
@Slf4j
public class LocalNotificationBus implements NotificationSink {

    private final Map<String, List<EventSubscriber>> registrations;
    private final List<EventSubscriber> wildcardSubscribers;
    private final Counter dispatchedCounter;
    private final Counter failedCounter;

    public LocalNotificationBus(List<EventSubscriber> subscribers, MeterRegistry meterRegistry) {
        Map<String, List<EventSubscriber>> byType = new LinkedHashMap<>();
        List<EventSubscriber> wildcard = new ArrayList<>();
        for (EventSubscriber subscriber : subscribers) {
            for (String eventType : subscriber.subscribedEventTypes()) {
                if (EventSubscriber.ALL_EVENTS.equals(eventType)) {
                    wildcard.add(subscriber);
                } else {
                    byType.computeIfAbsent(eventType, t -> new ArrayList<>()).add(subscriber);
                }
            }
        }
        this.registrations = Collections.unmodifiableMap(byType);
        this.wildcardSubscribers = List.copyOf(wildcard);
        this.dispatchedCounter = Counter.builder("notifications.dispatched")
                .tag("status", "success")
                .description("Events delivered to a subscriber")
                .register(meterRegistry);
        this.failedCounter = Counter.builder("notifications.dispatched")
                .tag("status", "error")
                .description("Subscriber failures while handling an event")
                .register(meterRegistry);

        log.info("Notification bus initialized: subscribers={}, eventTypes={}, wildcard={}",
                subscribers.size(), registrations.keySet(), wildcardSubscribers.size());
    }

    @Override
    public void publish(RecordedEvent event) {
        List<EventSubscriber> targets = new ArrayList<>(registrations.getOrDefault(event.getEventType(), List.of()));
        targets.addAll(wildcardSubscribers);

        for (EventSubscriber subscriber : targets) {
            try {
                subscriber.handle(event);
                dispatchedCounter.increment();
            } catch (RuntimeException e) {
                failedCounter.increment();
                log.error("Subscriber failed: subscriber={}, eventType={}, aggregateId={}, insertionId={}",
                        subscriber.name(), event.getEventType(), event.getAggregateId(), event.getInsertionId(), e);
            }
        }
    }

    public List<EventSubscriber> subscribersOf(String eventType) {
        List<EventSubscriber> targets = new ArrayList<>(registrations.getOrDefault(eventType, List.of()));
        targets.addAll(wildcardSubscribers);
        return targets;
    }
}
