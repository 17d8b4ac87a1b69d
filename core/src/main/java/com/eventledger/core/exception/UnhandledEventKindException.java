package com.eventledger.core.exception;

/**
 * Raised when an aggregate type has no handler (or no decoder) for an event kind.
 */
public class UnhandledEventKindException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String aggregateType;
    private final String eventType;

    public UnhandledEventKindException(String aggregateType, String eventType) {
        super(String.format("Aggregate type %s has no handler for event kind %s", aggregateType, eventType));
        this.aggregateType = aggregateType;
        this.eventType = eventType;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public String getEventType() {
        return eventType;
    }
}
