package com.eventledger.core.exception;

public class ActionNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final long actionId;

    public ActionNotFoundException(long actionId) {
        super("Action not found: " + actionId);
        this.actionId = actionId;
    }

    public long getActionId() {
        return actionId;
    }
}
