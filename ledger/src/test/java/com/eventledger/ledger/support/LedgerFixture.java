package com.eventledger.ledger.support;

import com.eventledger.core.action.Action;
import com.eventledger.core.action.MonotonicSequenceGenerator;
import com.eventledger.core.event.RecordedEvent;
import com.eventledger.core.replay.MutableReplayEngine;
import com.eventledger.core.store.EventCodec;
import com.eventledger.core.store.EventSourcingRegistry;
import com.eventledger.core.store.memory.InMemoryAggregateStore;
import com.eventledger.core.store.memory.InMemoryEventStore;
import com.eventledger.core.uow.UnitOfWorkManager;
import com.eventledger.ledger.domain.Account;
import com.eventledger.ledger.domain.LedgerJacksonModule;
import com.eventledger.ledger.projection.AccountReadModel;
import com.eventledger.ledger.service.LedgerCommandService;
import com.eventledger.ledger.service.LedgerQueryService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.transaction.support.TransactionOperations;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.mockito.Mockito.mock;

/**
 * Ledger services over in-memory stores, wired the way the Spring configuration wires them.
 * The read model is a Mockito mock that always misses.
 */
public class LedgerFixture {

    public static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    public final SteppingClock clock = new SteppingClock(NOW);
    public final ObjectMapper objectMapper = objectMapper();
    public final EventCodec codec = new EventCodec(objectMapper);
    public final InMemoryEventStore accountEvents = new InMemoryEventStore(Account.TYPE, codec, clock);
    public final InMemoryAggregateStore<Account> accounts = new InMemoryAggregateStore<>(Account.TYPE, accountEvents, codec);
    public final InMemoryEventStore actionEvents = new InMemoryEventStore(Action.TYPE, codec, clock);
    public final InMemoryAggregateStore<Action> actions = new InMemoryAggregateStore<>(Action.TYPE, actionEvents, codec);
    public final EventSourcingRegistry registry = new EventSourcingRegistry(List.of(accounts, actions));
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final List<RecordedEvent> published = new ArrayList<>();
    public final UnitOfWorkManager unitOfWorkManager = new UnitOfWorkManager(
            TransactionOperations.withoutTransaction(), registry, published::add, meterRegistry);
    public final MutableReplayEngine replayEngine = new MutableReplayEngine(registry);
    public final AccountReadModel readModel = mock(AccountReadModel.class);

    public final LedgerCommandService commands = new LedgerCommandService(
            unitOfWorkManager, replayEngine, accounts, actions, new MonotonicSequenceGenerator(1, clock), clock);
    public final LedgerQueryService queries = new LedgerQueryService(readModel, replayEngine, accounts, actions);

    public static ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(new LedgerJacksonModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public String openAccount(String name) {
        return commands.openAccount(name).getId();
    }

    public BigDecimal balance(String accountId) {
        return accounts.find(accountId).orElseThrow().getBalance();
    }

    public long version(String accountId) {
        return accounts.currentVersion(accountId).orElseThrow();
    }
}
