package com.eventledger.ledger.service;

import com.eventledger.core.action.Action;
import com.eventledger.core.event.RecordedEvent;
import com.eventledger.core.exception.ActionNotFoundException;
import com.eventledger.core.exception.VersionConflictException;
import com.eventledger.ledger.domain.Account;
import com.eventledger.ledger.domain.AccountClosedException;
import com.eventledger.ledger.domain.AccountEvents;
import com.eventledger.ledger.domain.AccountEvents.FundsDeposited;
import com.eventledger.ledger.domain.AccountNotFoundException;
import com.eventledger.ledger.domain.InsufficientFundsException;
import com.eventledger.ledger.domain.LedgerActions.TransferDetails;
import com.eventledger.ledger.support.LedgerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Ledger scenarios end to end over the in-memory stores.
 *
 * Base history on one account: deposit 100 (A1, T1), deposit 50 (A2, T2). Balance 150.
 */
class LedgerCommandServiceTest {

    private final LedgerFixture fixture = new LedgerFixture();
    private final LedgerCommandService commands = fixture.commands;

    private String checking;
    private Instant t1;
    private Instant t2;
    private Action a1;
    private Action a2;

    @BeforeEach
    void setUp() {
        checking = fixture.openAccount("Checking");
        t1 = fixture.clock.advance(Duration.ofHours(1));
        a1 = commands.recordDeposit(checking, new BigDecimal("100"), null);
        t2 = fixture.clock.advance(Duration.ofHours(1));
        a2 = commands.recordDeposit(checking, new BigDecimal("50"), null);
        fixture.clock.advance(Duration.ofHours(1));
    }

    private List<RecordedEvent> eventsOf(Action action) {
        return fixture.accountEvents.eventsForAction(action.getSequenceNumber());
    }

    private static BigDecimal amountOf(RecordedEvent recorded) {
        return ((FundsDeposited) recorded.getEvent()).getAmount();
    }

    private double completed(String outcome) {
        return fixture.meterRegistry.get("unit_of_work.completed").tag("outcome", outcome).counter().count();
    }

    // ─── Record ───────────────────────────────────────────────────────────────

    @Test
    @DisplayName("record - deposits at the current time accumulate in order")
    void recordsDeposits() {
        assertThat(fixture.balance(checking)).isEqualByComparingTo("150");
        assertThat(a1.getEffectiveAt()).isEqualTo(t1);
        assertThat(a2.getEffectiveAt()).isEqualTo(t2);
        assertThat(a2.getSequenceNumber()).isGreaterThan(a1.getSequenceNumber());
        assertThat(a1.getRevisionNumber()).isEqualTo(1);

        assertThat(eventsOf(a1)).singleElement().satisfies(recorded -> {
            assertThat(recorded.getEventType()).isEqualTo(AccountEvents.FUNDS_DEPOSITED);
            assertThat(recorded.getOccurredAt()).isEqualTo(t1);
            assertThat(recorded.getSequenceNumber()).isEqualTo(a1.getSequenceNumber());
        });
        assertThat(fixture.actions.find(Action.idOf(a1.getSequenceNumber()))).isPresent();
    }

    @Test
    @DisplayName("record - effective times are truncated to whole seconds")
    void truncatesEffectiveTime() {
        fixture.clock.advance(Duration.ofMillis(750));
        Action deposit = commands.recordDeposit(checking, BigDecimal.ONE, null);

        assertThat(deposit.getEffectiveAt().getNano()).isZero();
    }

    @Test
    @DisplayName("record - backdated withdrawal lands before existing history and is replayed through it")
    void backdatedWithdrawal() {
        Instant t0 = LedgerFixture.NOW.minus(Duration.ofDays(1));
        Action withdrawal = commands.recordWithdrawal(checking, new BigDecimal("30"), t0);

        assertThat(withdrawal.getEffectiveAt()).isEqualTo(t0);
        assertThat(fixture.balance(checking)).isEqualByComparingTo("120");
        assertThat(fixture.queries.accountBefore(checking, t0).getBalance()).isEqualByComparingTo("0");
        assertThat(fixture.queries.accountAsOf(checking, t0).getBalance()).isEqualByComparingTo("-30");
        assertThat(fixture.queries.accountAsOf(checking, t1).getBalance()).isEqualByComparingTo("70");

        // later actions keep their events
        assertThat(eventsOf(a1)).extracting(RecordedEvent::isTombstoned).containsExactly(false);
        assertThat(eventsOf(a2)).extracting(RecordedEvent::isTombstoned).containsExactly(false);
    }

    @Test
    @DisplayName("record - backdating needs at least two seconds of distance from now")
    void backdateTooRecent() {
        Instant now = fixture.clock.instant();

        assertThatThrownBy(() -> commands.recordDeposit(checking, BigDecimal.TEN, now.minusSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("in the past");
        assertThatThrownBy(() -> commands.recordDeposit(checking, BigDecimal.TEN, now.plusSeconds(60)))
                .isInstanceOf(IllegalArgumentException.class);

        commands.recordDeposit(checking, BigDecimal.TEN, now.minusSeconds(2));
        assertThat(fixture.balance(checking)).isEqualByComparingTo("160");
    }

    @Test
    @DisplayName("record - unknown account and non-positive amount are rejected without side effects")
    void recordRejectsBadInput() {
        assertThatThrownBy(() -> commands.recordDeposit("acc_missing", BigDecimal.TEN, null))
                .isInstanceOf(AccountNotFoundException.class);
        assertThatThrownBy(() -> commands.recordWithdrawal(checking, BigDecimal.ZERO, null))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(fixture.balance(checking)).isEqualByComparingTo("150");
        assertThat(fixture.actions.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("record - transfer moves money between two accounts in one action")
    void recordsTransfer() {
        String savings = fixture.openAccount("Savings");
        Action transfer = commands.recordTransfer(checking, savings, new BigDecimal("40"), null);

        assertThat(fixture.balance(checking)).isEqualByComparingTo("110");
        assertThat(fixture.balance(savings)).isEqualByComparingTo("40");
        assertThat(transfer.getInvolvedAggregateIds()).containsExactly(checking, savings);
        assertThat(eventsOf(transfer)).extracting(RecordedEvent::getEventType)
                .containsExactly(AccountEvents.FUNDS_TRANSFERRED_OUT, AccountEvents.FUNDS_TRANSFERRED_IN);
    }

    @Test
    @DisplayName("record - transfer larger than the balance is rejected")
    void transferOverdraw() {
        String savings = fixture.openAccount("Savings");

        assertThatThrownBy(() -> commands.recordTransfer(checking, savings, new BigDecimal("151"), null))
                .isInstanceOf(InsufficientFundsException.class);
        assertThat(fixture.balance(savings)).isEqualByComparingTo("0");
    }

    // ─── Edit ─────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("edit - correcting an early deposit replays later deposits without touching their events")
    void editEarlyDeposit() {
        List<Long> a2InsertionIds = eventsOf(a2).stream().map(RecordedEvent::getInsertionId).toList();

        Action edited = commands.editDeposit(a1.getSequenceNumber(), checking, new BigDecimal("200"));

        assertThat(fixture.balance(checking)).isEqualByComparingTo("250");
        assertThat(edited.getRevisionNumber()).isEqualTo(2);
        assertThat(edited.getEffectiveAt()).isEqualTo(t1);

        List<RecordedEvent> a1Events = eventsOf(a1);
        assertThat(a1Events).extracting(RecordedEvent::isTombstoned).containsExactly(true, false);
        assertThat(amountOf(a1Events.get(1))).isEqualByComparingTo("200");
        assertThat(a1Events.get(1).getOccurredAt()).isEqualTo(t1);

        List<RecordedEvent> a2Events = eventsOf(a2);
        assertThat(a2Events).extracting(RecordedEvent::getInsertionId).isEqualTo(a2InsertionIds);
        assertThat(a2Events).extracting(RecordedEvent::isTombstoned).containsExactly(false);
        assertThat(amountOf(a2Events.get(0))).isEqualByComparingTo("50");
    }

    @Test
    @DisplayName("edit - identical details leave the balance unchanged")
    void identicalEdit() {
        commands.editDeposit(a1.getSequenceNumber(), checking, new BigDecimal("100"));

        assertThat(fixture.balance(checking)).isEqualByComparingTo("150");
        assertThat(fixture.queries.accountAsOf(checking, t1).getBalance()).isEqualByComparingTo("100");
    }

    @Test
    @DisplayName("edit - correction that would overdraw a later transfer is rolled back whole")
    void editFailsOnReplay() {
        String savings = fixture.openAccount("Savings");
        Action transfer = commands.recordTransfer(checking, savings, new BigDecimal("120"), null);

        assertThatThrownBy(() -> commands.editDeposit(a1.getSequenceNumber(), checking, new BigDecimal("10")))
                .isInstanceOf(InsufficientFundsException.class)
                .hasMessageContaining(checking);

        assertThat(fixture.balance(checking)).isEqualByComparingTo("30");
        assertThat(fixture.balance(savings)).isEqualByComparingTo("120");
        assertThat(eventsOf(a1)).extracting(RecordedEvent::isTombstoned).containsExactly(false);
        assertThat(eventsOf(transfer)).extracting(RecordedEvent::isTombstoned).containsExactly(false, false);
        assertThat(completed("discarded")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("edit - redirecting a transfer restores the old recipient and credits the new one")
    void editTransferRecipient() {
        String savings = fixture.openAccount("Savings");
        String holiday = fixture.openAccount("Holiday");
        Action transfer = commands.recordTransfer(checking, savings, new BigDecimal("80"), null);
        fixture.clock.advance(Duration.ofMinutes(5));

        Action edited = commands.editTransfer(transfer.getSequenceNumber(), checking, holiday, new BigDecimal("30"));

        assertThat(fixture.balance(checking)).isEqualByComparingTo("120");
        assertThat(fixture.balance(savings)).isEqualByComparingTo("0");
        assertThat(fixture.balance(holiday)).isEqualByComparingTo("30");
        assertThat(((TransferDetails) edited.getDetails()).getToAccountId()).isEqualTo(holiday);
        assertThat(edited.getInvolvedAggregateIds()).containsExactly(checking, holiday);
    }

    @Test
    @DisplayName("edit - details of another action type are rejected")
    void editWrongType() {
        assertThatThrownBy(() -> commands.editWithdrawal(a1.getSequenceNumber(), checking, BigDecimal.TEN))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("deposit");
        assertThat(fixture.balance(checking)).isEqualByComparingTo("150");
    }

    @Test
    @DisplayName("edit / delete - unknown action id")
    void unknownAction() {
        assertThatThrownBy(() -> commands.editDeposit(42L, checking, BigDecimal.TEN))
                .isInstanceOf(ActionNotFoundException.class);
        assertThatThrownBy(() -> commands.deleteAction(42L))
                .isInstanceOf(ActionNotFoundException.class);
    }

    // ─── Delete ───────────────────────────────────────────────────────────────

    @Test
    @DisplayName("delete - tombstones every event of the action and replays the rest")
    void deleteAction() {
        commands.editDeposit(a2.getSequenceNumber(), checking, new BigDecimal("60"));

        Action deleted = commands.deleteAction(a2.getSequenceNumber());

        assertThat(deleted.isDeleted()).isTrue();
        assertThat(fixture.balance(checking)).isEqualByComparingTo("100");
        assertThat(eventsOf(a2)).hasSize(2).allMatch(RecordedEvent::isTombstoned);
        assertThat(eventsOf(a1)).extracting(RecordedEvent::isTombstoned).containsExactly(false);
    }

    @Test
    @DisplayName("delete - a deleted action can be neither deleted again nor edited")
    void deletedIsTerminal() {
        commands.deleteAction(a1.getSequenceNumber());

        assertThatThrownBy(() -> commands.deleteAction(a1.getSequenceNumber()))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> commands.editDeposit(a1.getSequenceNumber(), checking, BigDecimal.TEN))
                .isInstanceOf(IllegalStateException.class);
        assertThat(fixture.balance(checking)).isEqualByComparingTo("50");
    }

    // ─── Account Lifecycle ────────────────────────────────────────────────────

    @Test
    @DisplayName("accounts - rename with a stale expected version is a conflict")
    void renameWithStaleVersion() {
        long version = fixture.version(checking);

        Account renamed = commands.renameAccount(checking, "Everyday", version);
        assertThat(renamed.getName()).isEqualTo("Everyday");

        assertThatThrownBy(() -> commands.renameAccount(checking, "Bills", version))
                .isInstanceOf(VersionConflictException.class);
        assertThat(fixture.accounts.find(checking).orElseThrow().getName()).isEqualTo("Everyday");
    }

    @Test
    @DisplayName("accounts - only an empty account closes, and a closed account takes no money")
    void closeAccount() {
        assertThatThrownBy(() -> commands.closeAccount(checking, null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("balance");

        String spare = fixture.openAccount("Spare");
        Account closed = commands.closeAccount(spare, null);
        assertThat(closed.getStatus()).isEqualTo(Account.Status.CLOSED);

        assertThatThrownBy(() -> commands.recordDeposit(spare, BigDecimal.TEN, null))
                .isInstanceOf(AccountClosedException.class);
    }

    @Test
    @DisplayName("accounts - open assigns a prefixed id and starts at zero")
    void openAccount() {
        Account account = commands.openAccount("Travel");

        assertThat(account.getId()).startsWith("acc_").hasSize(16);
        assertThat(account.getBalance()).isEqualByComparingTo("0");
        assertThat(account.getVersion()).isEqualTo(1L);
        assertThatThrownBy(() -> commands.openAccount(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ─── Notifications ────────────────────────────────────────────────────────

    @Test
    @DisplayName("notifications - committed account and action events are published")
    void publishesCommittedEvents() {
        fixture.published.clear();

        commands.editDeposit(a1.getSequenceNumber(), checking, new BigDecimal("70"));

        assertThat(fixture.published).extracting(RecordedEvent::getEventType)
                .containsExactlyInAnyOrder(AccountEvents.FUNDS_DEPOSITED, "action.edited");
    }
}
