package com.eventledger.core.notification;

import com.eventledger.core.event.RecordedEvent;

/**
 * Receives finalized events after the unit of work has committed.
 * Delivery is best-effort and outside the storage transaction.
 */
public interface NotificationSink {

    void publish(RecordedEvent event);
}
