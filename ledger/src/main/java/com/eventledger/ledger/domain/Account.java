package com.eventledger.ledger.domain;

import com.eventledger.core.aggregate.AggregateRoot;
import com.eventledger.core.aggregate.AggregateType;
import com.eventledger.core.event.ValueChange;
import com.eventledger.ledger.domain.AccountEvents.AccountClosed;
import com.eventledger.ledger.domain.AccountEvents.AccountOpened;
import com.eventledger.ledger.domain.AccountEvents.AccountRenamed;
import com.eventledger.ledger.domain.AccountEvents.FundsDeposited;
import com.eventledger.ledger.domain.AccountEvents.FundsTransferredIn;
import com.eventledger.ledger.domain.AccountEvents.FundsTransferredOut;
import com.eventledger.ledger.domain.AccountEvents.FundsWithdrawn;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Account Aggregate
 *
 * Balance is the fold of the account's money movements in event order:
 *  - Withdrawals may take the balance below zero
 *  - A transfer out larger than the balance at its point in history is rejected,
 *    both when first applied and when reapplied after a correction
 *  - Money movements require an OPEN account; a closed account must have a zero balance
 */
@Getter
public class Account extends AggregateRoot<Account> {

    public enum Status {
        OPEN,
        CLOSED
    }

    public static final AggregateType<Account> TYPE = AggregateType.<Account>builder("account", Account::new)
            .on(AccountEvents.ACCOUNT_OPENED, AccountOpened.class, Account::onOpened)
            .on(AccountEvents.ACCOUNT_RENAMED, AccountRenamed.class, Account::onRenamed)
            .on(AccountEvents.ACCOUNT_CLOSED, AccountClosed.class, Account::onClosed)
            .on(AccountEvents.FUNDS_DEPOSITED, FundsDeposited.class, Account::onDeposited)
            .on(AccountEvents.FUNDS_WITHDRAWN, FundsWithdrawn.class, Account::onWithdrawn)
            .on(AccountEvents.FUNDS_TRANSFERRED_OUT, FundsTransferredOut.class, Account::onTransferredOut)
            .on(AccountEvents.FUNDS_TRANSFERRED_IN, FundsTransferredIn.class, Account::onTransferredIn)
            .build();

    private String name;
    private BigDecimal balance = BigDecimal.ZERO;
    private Status status;
    private Instant openedAt;
    private Instant closedAt;

    protected Account() {
    }

    @Override
    public AggregateType<Account> aggregateType() {
        return TYPE;
    }

    // ─── Behaviour ────────────────────────────────────────────────────────────

    public static Account open(String accountId, String name, Instant openedAt) {
        requireName(name);
        Account account = new Account();
        account.apply(new AccountOpened(accountId, name, openedAt));
        return account;
    }

    public void rename(String newName, Instant at) {
        requireName(newName);
        if (newName.equals(name)) {
            return;
        }
        apply(new AccountRenamed(getId(), at, new ValueChange<>(name, newName)));
    }

    public void close(Instant at) {
        checkOpen();
        if (balance.signum() != 0) {
            throw new IllegalStateException(String.format(
                    "Account %s cannot be closed with a balance of %s", getId(), balance.toPlainString()));
        }
        apply(new AccountClosed(getId(), at));
    }

    public void deposit(BigDecimal amount, Instant effectiveAt, long sequenceNumber) {
        checkOpen();
        requirePositive(amount);
        apply(new FundsDeposited(getId(), effectiveAt, sequenceNumber, amount));
    }

    public void withdraw(BigDecimal amount, Instant effectiveAt, long sequenceNumber) {
        checkOpen();
        requirePositive(amount);
        apply(new FundsWithdrawn(getId(), effectiveAt, sequenceNumber, amount));
    }

    public void transferOut(BigDecimal amount, String toAccountId, Instant effectiveAt, long sequenceNumber) {
        checkOpen();
        requirePositive(amount);
        apply(new FundsTransferredOut(getId(), effectiveAt, sequenceNumber, amount, toAccountId));
    }

    public void transferIn(BigDecimal amount, String fromAccountId, Instant effectiveAt, long sequenceNumber) {
        checkOpen();
        requirePositive(amount);
        apply(new FundsTransferredIn(getId(), effectiveAt, sequenceNumber, amount, fromAccountId));
    }

    public boolean isOpen() {
        return status == Status.OPEN;
    }

    private void checkOpen() {
        if (!isOpen()) {
            throw new AccountClosedException(getId());
        }
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Account name is required");
        }
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive: " + amount);
        }
    }

    // ─── Handlers ─────────────────────────────────────────────────────────────

    private void onOpened(AccountOpened event) {
        assignId(event.getAggregateId());
        this.name = event.getName();
        this.openedAt = event.getOpenedAt();
        this.status = Status.OPEN;
    }

    private void onRenamed(AccountRenamed event) {
        this.name = event.getName().getCurrent();
    }

    private void onClosed(AccountClosed event) {
        this.status = Status.CLOSED;
        this.closedAt = event.getOccurredAt();
    }

    private void onDeposited(FundsDeposited event) {
        this.balance = balance.add(event.getAmount());
    }

    private void onWithdrawn(FundsWithdrawn event) {
        this.balance = balance.subtract(event.getAmount());
    }

    private void onTransferredOut(FundsTransferredOut event) {
        if (balance.compareTo(event.getAmount()) < 0) {
            throw new InsufficientFundsException(getId(), balance, event.getAmount(), event.getSequenceNumber());
        }
        this.balance = balance.subtract(event.getAmount());
    }

    private void onTransferredIn(FundsTransferredIn event) {
        this.balance = balance.add(event.getAmount());
    }
}
