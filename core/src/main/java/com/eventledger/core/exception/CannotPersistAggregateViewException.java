package com.eventledger.core.exception;

public class CannotPersistAggregateViewException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CannotPersistAggregateViewException(String aggregateType, String aggregateId) {
        super(String.format("%s %s is a read-only historical view and cannot be persisted", aggregateType, aggregateId));
    }
}
