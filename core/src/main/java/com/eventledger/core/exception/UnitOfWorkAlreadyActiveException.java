package com.eventledger.core.exception;

public class UnitOfWorkAlreadyActiveException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public UnitOfWorkAlreadyActiveException() {
        super("A unit of work is already active on this thread; scopes cannot be nested");
    }
}
