package com.eventledger.ledger.service;

import com.eventledger.core.action.Action;
import com.eventledger.core.event.RecordedEvent;
import com.eventledger.core.exception.ActionNotFoundException;
import com.eventledger.core.replay.MutableReplayEngine;
import com.eventledger.core.store.AggregateStore;
import com.eventledger.ledger.domain.Account;
import com.eventledger.ledger.domain.AccountNotFoundException;
import com.eventledger.ledger.projection.AccountReadModel;
import com.eventledger.ledger.projection.AccountSnapshot;
import com.eventledger.ledger.projection.LedgerSources;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Ledger Query Service: read side
 *
 * Current accounts: Redis read model first, aggregate store on a miss.
 * Historical balances are replayed from the event store and never cached.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerQueryService {

    private final AccountReadModel readModel;
    private final MutableReplayEngine replayEngine;
    private final AggregateStore<Account> accounts;
    private final AggregateStore<Action> actions;

    public AccountSnapshot getAccount(String accountId) {
        return readModel.find(accountId).orElseGet(() -> {
            log.debug("Read model miss, loading from event store: accountId={}", accountId);
            Account account = accounts.find(accountId).orElseThrow(() -> new AccountNotFoundException(accountId));
            readModel.save(AccountSnapshot.of(account, LedgerSources.READ_MODEL));
            return AccountSnapshot.of(account, LedgerSources.EVENT_STORE);
        });
    }

    /**
     * Account as of the end of the instant: every event at or before it counts.
     */
    public AccountSnapshot accountAsOf(String accountId, Instant at) {
        Account account = replayEngine.loadAggregateStatesAt(Account.TYPE, List.of(accountId), at).get(accountId);
        if (account == null) {
            throw new AccountNotFoundException(accountId);
        }
        return AccountSnapshot.of(account, LedgerSources.EVENT_STORE);
    }

    /**
     * Account strictly before the instant.
     */
    public AccountSnapshot accountBefore(String accountId, Instant at) {
        Account account = replayEngine.loadAggregateStatesBefore(Account.TYPE, List.of(accountId), at, null).get(accountId);
        if (account == null) {
            throw new AccountNotFoundException(accountId);
        }
        return AccountSnapshot.of(account, LedgerSources.EVENT_STORE);
    }

    /**
     * Every event of the account in event order, tombstoned corrections included.
     */
    public List<RecordedEvent> auditTrail(String accountId) {
        if (accounts.currentVersion(accountId).isEmpty()) {
            throw new AccountNotFoundException(accountId);
        }
        return accounts.eventStore().auditTrail(accountId);
    }

    public Action getAction(long actionId) {
        return actions.find(Action.idOf(actionId)).orElseThrow(() -> new ActionNotFoundException(actionId));
    }

    /**
     * Account events produced by the action, including the tombstoned ones of earlier revisions.
     */
    public List<RecordedEvent> actionEvents(long actionId) {
        getAction(actionId);
        return accounts.eventStore().eventsForAction(actionId);
    }
}
