package com.eventledger.ledger.projection;

import com.eventledger.core.action.Action;
import com.eventledger.core.action.ActionEvents;
import com.eventledger.core.action.ActionEvents.ActionEdited;
import com.eventledger.core.event.RecordedEvent;
import com.eventledger.core.notification.EventSubscriber;
import com.eventledger.core.store.AggregateStore;
import com.eventledger.ledger.domain.Account;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Keeps the Redis account read model in step with committed events.
 *
 * A correction rewrites an account's balance without an account event at the
 * current time, so action events also refresh every account the action touches
 * (before and after an edit).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AccountReadModelProjector implements EventSubscriber {

    private final AccountReadModel readModel;
    private final AggregateStore<Account> accounts;
    private final AggregateStore<Action> actions;

    @Override
    public Set<String> subscribedEventTypes() {
        return Set.of(ALL_EVENTS);
    }

    @Override
    public void handle(RecordedEvent event) {
        Set<String> accountIds = new LinkedHashSet<>();
        if (Account.TYPE.getName().equals(event.getAggregateType())) {
            accountIds.add(event.getAggregateId());
        } else if (Action.TYPE.getName().equals(event.getAggregateType())) {
            actions.find(event.getAggregateId())
                    .ifPresent(action -> accountIds.addAll(action.getInvolvedAggregateIds()));
            if (ActionEvents.ACTION_EDITED.equals(event.getEventType())) {
                ActionEdited edited = (ActionEdited) event.getEvent();
                accountIds.addAll(edited.getDetails().getPrevious().involvedAggregateIds());
            }
        }
        accountIds.forEach(this::refresh);
    }

    private void refresh(String accountId) {
        accounts.find(accountId).ifPresentOrElse(
                account -> readModel.save(AccountSnapshot.of(account, LedgerSources.READ_MODEL)),
                () -> readModel.evict(accountId));
        log.debug("Account read model refreshed: accountId={}", accountId);
    }
}
