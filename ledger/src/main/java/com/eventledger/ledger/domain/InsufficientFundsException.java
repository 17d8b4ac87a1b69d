package com.eventledger.ledger.domain;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * A transfer out exceeds the balance available at its point in history.
 */
@Getter
public class InsufficientFundsException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String accountId;
    private final BigDecimal available;
    private final BigDecimal requested;

    public InsufficientFundsException(String accountId, BigDecimal available, BigDecimal requested, Long actionId) {
        super(String.format("Insufficient funds in account %s for action %s: available=%s, requested=%s",
                accountId, actionId, available.toPlainString(), requested.toPlainString()));
        this.accountId = accountId;
        this.available = available;
        this.requested = requested;
    }
}
