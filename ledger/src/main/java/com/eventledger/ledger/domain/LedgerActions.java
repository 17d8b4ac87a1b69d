package com.eventledger.ledger.domain;

import com.eventledger.core.action.ActionDetails;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Payloads of the ledger's actions. The action type doubles as the Jackson type id,
 * see {@link LedgerJacksonModule}.
 */
public final class LedgerActions {

    public static final String DEPOSIT = "deposit";
    public static final String WITHDRAWAL = "withdrawal";
    public static final String TRANSFER = "transfer";

    private LedgerActions() {}

    @Value
    public static class DepositDetails implements ActionDetails {
        String accountId;
        BigDecimal amount;

        @JsonCreator
        public DepositDetails(@JsonProperty("accountId") String accountId,
                              @JsonProperty("amount") BigDecimal amount) {
            this.accountId = accountId;
            this.amount = amount;
        }

        @Override
        public String getActionType() {
            return DEPOSIT;
        }

        @Override
        public List<String> involvedAggregateIds() {
            return List.of(accountId);
        }
    }

    @Value
    public static class WithdrawalDetails implements ActionDetails {
        String accountId;
        BigDecimal amount;

        @JsonCreator
        public WithdrawalDetails(@JsonProperty("accountId") String accountId,
                                 @JsonProperty("amount") BigDecimal amount) {
            this.accountId = accountId;
            this.amount = amount;
        }

        @Override
        public String getActionType() {
            return WITHDRAWAL;
        }

        @Override
        public List<String> involvedAggregateIds() {
            return List.of(accountId);
        }
    }

    @Value
    public static class TransferDetails implements ActionDetails {
        String fromAccountId;
        String toAccountId;
        BigDecimal amount;

        @JsonCreator
        public TransferDetails(@JsonProperty("fromAccountId") String fromAccountId,
                               @JsonProperty("toAccountId") String toAccountId,
                               @JsonProperty("amount") BigDecimal amount) {
            if (fromAccountId != null && fromAccountId.equals(toAccountId)) {
                throw new IllegalArgumentException("Cannot transfer from an account to itself: " + fromAccountId);
            }
            this.fromAccountId = fromAccountId;
            this.toAccountId = toAccountId;
            this.amount = amount;
        }

        @Override
        public String getActionType() {
            return TRANSFER;
        }

        @Override
        public List<String> involvedAggregateIds() {
            return List.of(fromAccountId, toAccountId);
        }
    }
}
