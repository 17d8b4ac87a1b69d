package com.eventledger.core.notification;

import com.eventledger.core.event.RecordedEvent;

import java.util.Set;

/**
 * Handler registered with the {@link LocalNotificationBus}.
 */
public interface EventSubscriber {

    /**
     * Subscribes to every event kind.
     */
    String ALL_EVENTS = "*";

    /**
     * Event kinds this subscriber handles, or {@link #ALL_EVENTS}.
     */
    Set<String> subscribedEventTypes();

    void handle(RecordedEvent event);

    default String name() {
        return getClass().getSimpleName();
    }
}
