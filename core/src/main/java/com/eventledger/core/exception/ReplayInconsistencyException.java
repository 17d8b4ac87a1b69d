package com.eventledger.core.exception;

/**
 * Stored history violates a replay invariant (tombstoned event in a fold,
 * events out of total order, orphaned action events). Never recovered silently.
 */
public class ReplayInconsistencyException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ReplayInconsistencyException(String message) {
        super(message);
    }
}
