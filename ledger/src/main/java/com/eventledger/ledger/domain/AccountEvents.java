package com.eventledger.ledger.domain;

import com.eventledger.core.event.AggregateEvent;
import com.eventledger.core.event.ValueChange;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Account Events
 *
 * Lifecycle events (opened, renamed, closed) are never sequenced: they are not
 * produced by an action and cannot be edited. AccountOpened is placed at the epoch
 * so every rewind, however far back, starts from an opened account.
 *
 * Money movements carry the producing action's sequence number and effective time.
 */
public final class AccountEvents {

    public static final String ACCOUNT_OPENED = "account.opened";
    public static final String ACCOUNT_RENAMED = "account.renamed";
    public static final String ACCOUNT_CLOSED = "account.closed";
    public static final String FUNDS_DEPOSITED = "account.funds-deposited";
    public static final String FUNDS_WITHDRAWN = "account.funds-withdrawn";
    public static final String FUNDS_TRANSFERRED_OUT = "account.funds-transferred-out";
    public static final String FUNDS_TRANSFERRED_IN = "account.funds-transferred-in";

    private AccountEvents() {}

    // ─── Lifecycle ────────────────────────────────────────────────────────────

    @Getter
    @ToString(callSuper = true)
    public static class AccountOpened extends AggregateEvent {
        private final String name;
        private final Instant openedAt;

        @JsonCreator
        public AccountOpened(@JsonProperty("aggregateId") String aggregateId,
                             @JsonProperty("name") String name,
                             @JsonProperty("openedAt") Instant openedAt) {
            super(ACCOUNT_OPENED, aggregateId, Instant.EPOCH, null);
            this.name = name;
            this.openedAt = openedAt;
        }
    }

    @Getter
    @ToString(callSuper = true)
    public static class AccountRenamed extends AggregateEvent {
        private final ValueChange<String> name;

        @JsonCreator
        public AccountRenamed(@JsonProperty("aggregateId") String aggregateId,
                              @JsonProperty("occurredAt") Instant occurredAt,
                              @JsonProperty("name") ValueChange<String> name) {
            super(ACCOUNT_RENAMED, aggregateId, occurredAt, null);
            this.name = name;
        }
    }

    @ToString(callSuper = true)
    public static class AccountClosed extends AggregateEvent {

        @JsonCreator
        public AccountClosed(@JsonProperty("aggregateId") String aggregateId,
                             @JsonProperty("occurredAt") Instant occurredAt) {
            super(ACCOUNT_CLOSED, aggregateId, occurredAt, null);
        }
    }

    // ─── Money Movements ──────────────────────────────────────────────────────

    @Getter
    @ToString(callSuper = true)
    public static class FundsDeposited extends AggregateEvent {
        private final BigDecimal amount;

        @JsonCreator
        public FundsDeposited(@JsonProperty("aggregateId") String aggregateId,
                              @JsonProperty("occurredAt") Instant occurredAt,
                              @JsonProperty("sequenceNumber") Long sequenceNumber,
                              @JsonProperty("amount") BigDecimal amount) {
            super(FUNDS_DEPOSITED, aggregateId, occurredAt, sequenceNumber);
            this.amount = amount;
        }
    }

    @Getter
    @ToString(callSuper = true)
    public static class FundsWithdrawn extends AggregateEvent {
        private final BigDecimal amount;

        @JsonCreator
        public FundsWithdrawn(@JsonProperty("aggregateId") String aggregateId,
                              @JsonProperty("occurredAt") Instant occurredAt,
                              @JsonProperty("sequenceNumber") Long sequenceNumber,
                              @JsonProperty("amount") BigDecimal amount) {
            super(FUNDS_WITHDRAWN, aggregateId, occurredAt, sequenceNumber);
            this.amount = amount;
        }
    }

    @Getter
    @ToString(callSuper = true)
    public static class FundsTransferredOut extends AggregateEvent {
        private final BigDecimal amount;
        private final String toAccountId;

        @JsonCreator
        public FundsTransferredOut(@JsonProperty("aggregateId") String aggregateId,
                                   @JsonProperty("occurredAt") Instant occurredAt,
                                   @JsonProperty("sequenceNumber") Long sequenceNumber,
                                   @JsonProperty("amount") BigDecimal amount,
                                   @JsonProperty("toAccountId") String toAccountId) {
            super(FUNDS_TRANSFERRED_OUT, aggregateId, occurredAt, sequenceNumber);
            this.amount = amount;
            this.toAccountId = toAccountId;
        }
    }

    @Getter
    @ToString(callSuper = true)
    public static class FundsTransferredIn extends AggregateEvent {
        private final BigDecimal amount;
        private final String fromAccountId;

        @JsonCreator
        public FundsTransferredIn(@JsonProperty("aggregateId") String aggregateId,
                                  @JsonProperty("occurredAt") Instant occurredAt,
                                  @JsonProperty("sequenceNumber") Long sequenceNumber,
                                  @JsonProperty("amount") BigDecimal amount,
                                  @JsonProperty("fromAccountId") String fromAccountId) {
            super(FUNDS_TRANSFERRED_IN, aggregateId, occurredAt, sequenceNumber);
            this.amount = amount;
            this.fromAccountId = fromAccountId;
        }
    }
}
