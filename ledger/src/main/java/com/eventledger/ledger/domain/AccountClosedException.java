package com.eventledger.ledger.domain;

public class AccountClosedException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public AccountClosedException(String accountId) {
        super("Account is closed: " + accountId);
    }
}
