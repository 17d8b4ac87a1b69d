package com.eventledger.core.exception;

public class NoActiveUnitOfWorkException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public NoActiveUnitOfWorkException() {
        super("No active unit of work: events can only be applied inside UnitOfWorkManager.execute(...)");
    }
}
