package com.eventledger.ledger.service;

import com.eventledger.core.action.Action;
import com.eventledger.core.action.ActionDetails;
import com.eventledger.core.action.SequenceGenerator;
import com.eventledger.core.exception.ActionNotFoundException;
import com.eventledger.core.replay.MutableReplayEngine;
import com.eventledger.core.store.AggregateStore;
import com.eventledger.core.uow.UnitOfWorkManager;
import com.eventledger.ledger.domain.Account;
import com.eventledger.ledger.domain.AccountNotFoundException;
import com.eventledger.ledger.domain.LedgerActions.DepositDetails;
import com.eventledger.ledger.domain.LedgerActions.TransferDetails;
import com.eventledger.ledger.domain.LedgerActions.WithdrawalDetails;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Ledger Command Service: write side
 *
 * Every use case runs in exactly one unit of work:
 *  - record:   current state + process, or (backdated) rewind at time + process + reapply
 *  - edit:     rewind at the action's point + tombstone + process + reapply
 *  - delete:   rewind at the action's point + tombstone + reapply
 *
 * Effective times are truncated to whole seconds. A VersionConflict means another
 * writer touched one of the accounts; the caller retries the whole use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerCommandService {

    static final Duration MIN_BACKDATE = Duration.ofSeconds(2);

    private final UnitOfWorkManager unitOfWorkManager;
    private final MutableReplayEngine replayEngine;
    private final AggregateStore<Account> accounts;
    private final AggregateStore<Action> actions;
    private final SequenceGenerator sequenceGenerator;
    private final Clock clock;

    // ─── Accounts ─────────────────────────────────────────────────────────────

    public Account openAccount(String name) {
        String accountId = "acc_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        Account account = unitOfWorkManager.execute(uow -> Account.open(accountId, name, clock.instant()));
        log.info("Account opened: accountId={}, name={}", accountId, name);
        return account;
    }

    public Account renameAccount(String accountId, String newName, Long expectedVersion) {
        return unitOfWorkManager.execute(uow -> {
            Account account = loadAccount(accountId);
            if (expectedVersion != null) {
                account.confirmVersion(expectedVersion);
            }
            account.rename(newName, clock.instant());
            log.info("Account renamed: accountId={}, name={}", accountId, newName);
            return account;
        });
    }

    public Account closeAccount(String accountId, Long expectedVersion) {
        return unitOfWorkManager.execute(uow -> {
            Account account = loadAccount(accountId);
            if (expectedVersion != null) {
                account.confirmVersion(expectedVersion);
            }
            account.close(clock.instant());
            log.info("Account closed: accountId={}", accountId);
            return account;
        });
    }

    // ─── Recording ────────────────────────────────────────────────────────────

    /**
     * @param effectiveAt null for "now"; a past instant backdates the deposit
     */
    public Action recordDeposit(String accountId, BigDecimal amount, Instant effectiveAt) {
        return record(new DepositDetails(accountId, amount), effectiveAt);
    }

    public Action recordWithdrawal(String accountId, BigDecimal amount, Instant effectiveAt) {
        return record(new WithdrawalDetails(accountId, amount), effectiveAt);
    }

    public Action recordTransfer(String fromAccountId, String toAccountId, BigDecimal amount, Instant effectiveAt) {
        return record(new TransferDetails(fromAccountId, toAccountId, amount), effectiveAt);
    }

    private Action record(ActionDetails details, Instant requestedEffectiveAt) {
        Instant now = clock.instant();
        boolean backdated = requestedEffectiveAt != null;
        Instant effectiveAt = backdated ? validateBackdate(requestedEffectiveAt, now) : now.truncatedTo(ChronoUnit.SECONDS);

        Action action = unitOfWorkManager.execute(uow -> {
            long sequenceNumber = sequenceGenerator.next();
            Map<String, Account> involved = loadAccounts(details.involvedAggregateIds());
            if (backdated) {
                Map<String, Account> rewound = replayEngine.loadEditableAggregatesAtTime(involved.values(), effectiveAt);
                process(details, rewound, effectiveAt, sequenceNumber);
                reapply(rewound.values(), effectiveAt, sequenceNumber);
            } else {
                process(details, involved, effectiveAt, sequenceNumber);
            }
            return Action.record(sequenceNumber, effectiveAt, now, details);
        });

        log.info("Action recorded: actionId={}, type={}, effectiveAt={}, backdated={}, accounts={}",
                action.getSequenceNumber(), details.getActionType(), effectiveAt, backdated,
                details.involvedAggregateIds());
        return action;
    }

    private Instant validateBackdate(Instant requested, Instant now) {
        Instant effectiveAt = requested.truncatedTo(ChronoUnit.SECONDS);
        if (effectiveAt.isAfter(now.minus(MIN_BACKDATE))) {
            throw new IllegalArgumentException(String.format(
                    "effectiveAt must be at least %d seconds in the past: %s", MIN_BACKDATE.toSeconds(), requested));
        }
        return effectiveAt;
    }

    // ─── Corrections ──────────────────────────────────────────────────────────

    public Action editDeposit(long actionId, String accountId, BigDecimal amount) {
        return edit(actionId, new DepositDetails(accountId, amount));
    }

    public Action editWithdrawal(long actionId, String accountId, BigDecimal amount) {
        return edit(actionId, new WithdrawalDetails(accountId, amount));
    }

    public Action editTransfer(long actionId, String fromAccountId, String toAccountId, BigDecimal amount) {
        return edit(actionId, new TransferDetails(fromAccountId, toAccountId, amount));
    }

    private Action edit(long actionId, ActionDetails newDetails) {
        Action edited = unitOfWorkManager.execute(uow -> {
            Action action = loadAction(actionId);
            action.checkEditable(newDetails);
            Instant effectiveAt = action.getEffectiveAt();

            // Accounts the action touched before the edit and accounts it touches after
            Set<String> accountIds = new LinkedHashSet<>(action.getInvolvedAggregateIds());
            accountIds.addAll(newDetails.involvedAggregateIds());

            Map<String, Account> rewound = replayEngine.loadEditableAggregatesAtTimeAndPoint(
                    loadAccounts(accountIds).values(), effectiveAt, actionId);
            action.edit(newDetails, clock.instant());
            process(newDetails, rewound, effectiveAt, actionId);
            reapply(rewound.values(), effectiveAt, actionId);
            return action;
        });

        log.info("Action edited: actionId={}, revision={}, type={}",
                actionId, edited.getRevisionNumber(), newDetails.getActionType());
        return edited;
    }

    public Action deleteAction(long actionId) {
        Action deleted = unitOfWorkManager.execute(uow -> {
            Action action = loadAction(actionId);
            if (action.isDeleted()) {
                throw new IllegalStateException("Action " + actionId + " has already been deleted");
            }
            Instant effectiveAt = action.getEffectiveAt();

            Map<String, Account> rewound = replayEngine.loadEditableAggregatesAtTimeAndPoint(
                    loadAccounts(action.getInvolvedAggregateIds()).values(), effectiveAt, actionId);
            action.delete(clock.instant());
            reapply(rewound.values(), effectiveAt, actionId);
            return action;
        });

        log.info("Action deleted: actionId={}, type={}", actionId, deleted.getActionType());
        return deleted;
    }

    // ─── Internals ────────────────────────────────────────────────────────────

    private void process(ActionDetails details, Map<String, Account> accounts, Instant effectiveAt, long sequenceNumber) {
        if (details instanceof DepositDetails deposit) {
            account(accounts, deposit.getAccountId()).deposit(deposit.getAmount(), effectiveAt, sequenceNumber);
        } else if (details instanceof WithdrawalDetails withdrawal) {
            account(accounts, withdrawal.getAccountId()).withdraw(withdrawal.getAmount(), effectiveAt, sequenceNumber);
        } else if (details instanceof TransferDetails transfer) {
            account(accounts, transfer.getFromAccountId())
                    .transferOut(transfer.getAmount(), transfer.getToAccountId(), effectiveAt, sequenceNumber);
            account(accounts, transfer.getToAccountId())
                    .transferIn(transfer.getAmount(), transfer.getFromAccountId(), effectiveAt, sequenceNumber);
        } else {
            throw new IllegalArgumentException("Unsupported action type: " + details.getActionType());
        }
    }

    private void reapply(Collection<Account> rewound, Instant effectiveAt, long sequenceNumber) {
        for (Account account : rewound) {
            replayEngine.reapplyDownstreamEventsFrom(account, effectiveAt, sequenceNumber);
        }
    }

    private static Account account(Map<String, Account> accounts, String accountId) {
        Account account = accounts.get(accountId);
        if (account == null) {
            throw new AccountNotFoundException(accountId);
        }
        return account;
    }

    private Account loadAccount(String accountId) {
        return accounts.find(accountId).orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    private Map<String, Account> loadAccounts(Collection<String> accountIds) {
        Map<String, Account> loaded = new LinkedHashMap<>();
        for (String accountId : accountIds) {
            loaded.put(accountId, loadAccount(accountId));
        }
        return loaded;
    }

    private Action loadAction(long actionId) {
        return actions.find(Action.idOf(actionId)).orElseThrow(() -> new ActionNotFoundException(actionId));
    }
}
