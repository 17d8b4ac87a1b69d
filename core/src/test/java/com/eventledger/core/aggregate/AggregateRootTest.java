package com.eventledger.core.aggregate;

import com.eventledger.core.exception.NoActiveUnitOfWorkException;
import com.eventledger.core.exception.VersionConflictException;
import com.eventledger.core.support.EventSourcingFixture;
import com.eventledger.core.support.Tally;
import com.eventledger.core.uow.UnitOfWork;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class AggregateRootTest {

    private static final Instant T1 = Instant.parse("2024-05-01T09:00:00Z");
    private static final Instant T2 = Instant.parse("2024-05-02T09:00:00Z");

    private final EventSourcingFixture fixture = new EventSourcingFixture();

    @Test
    @DisplayName("apply - outside a unit of work fails with NoActiveUnitOfWork")
    void applyRequiresUnitOfWork() {
        assertThatThrownBy(() -> Tally.open("t1", "groceries"))
                .isInstanceOf(NoActiveUnitOfWorkException.class);
    }

    @Test
    @DisplayName("apply - mutates state and buffers the event with the current unit of work")
    void applyRecordsWithUnitOfWork() {
        List<String> pending = fixture.unitOfWorkManager.execute(uow -> {
            Tally tally = Tally.open("t1", "groceries");
            tally.add(5, T1, 10L);
            assertThat(tally.getTotal()).isEqualTo(5);
            assertThat(uow.trackedAggregates()).containsExactly(tally);
            return uow.pendingEvents().stream().map(e -> e.getEventType()).toList();
        });

        assertThat(pending).containsExactly(Tally.OPENED, Tally.ADDED);
    }

    @Test
    @DisplayName("load - pure fold, leaves version untouched and needs no unit of work")
    void loadIsPure() {
        Tally tally = Tally.TYPE.identityOf("t1", 3L)
                .load(new Tally.Opened("t1", "groceries"))
                .load(new Tally.Added("t1", T1, 1L, 7));

        assertThat(tally.getTotal()).isEqualTo(7);
        assertThat(tally.getName()).isEqualTo("groceries");
        assertThat(tally.getVersion()).isEqualTo(3L);
        assertThat(UnitOfWork.current()).isEmpty();
    }

    @Test
    @DisplayName("loadAll - same events in the same order give the same state")
    void foldIsDeterministic() {
        List<com.eventledger.core.event.AggregateEvent> history = List.of(
                new Tally.Opened("t1", "groceries"),
                new Tally.Added("t1", T1, 1L, 5),
                new Tally.Doubled("t1", T2, 2L));

        Tally first = Tally.TYPE.identityOf("t1", 1L).loadAll(history);
        Tally second = Tally.TYPE.identityOf("t1", 1L).loadAll(history);

        assertThat(first.getTotal()).isEqualTo(10).isEqualTo(second.getTotal());
        assertThat(first.getOperations()).isEqualTo(2);
    }

    @Test
    @DisplayName("loadAll - order matters for non-commutative handlers")
    void foldIsOrderSensitive() {
        Tally addThenDouble = Tally.TYPE.identityOf("t1", 1L).loadAll(List.of(
                new Tally.Added("t1", T1, 1L, 5), new Tally.Doubled("t1", T2, 2L)));
        Tally doubleThenAdd = Tally.TYPE.identityOf("t1", 1L).loadAll(List.of(
                new Tally.Doubled("t1", T1, 1L), new Tally.Added("t1", T2, 2L, 5)));

        assertThat(addThenDouble.getTotal()).isEqualTo(10);
        assertThat(doubleThenAdd.getTotal()).isEqualTo(5);
    }

    @Test
    @DisplayName("confirmVersion - stale expectation fails fast with VersionConflict")
    void confirmVersion() {
        Tally tally = Tally.TYPE.identityOf("t1", 2L);

        assertThatCode(() -> tally.confirmVersion(2L)).doesNotThrowAnyException();
        assertThatThrownBy(() -> tally.confirmVersion(1L))
                .isInstanceOf(VersionConflictException.class)
                .hasMessageContaining("expected version=1, actual=2");
    }

    @Test
    @DisplayName("identity - blank copy carries id and version but no state")
    void identityCopy() {
        Tally tally = Tally.TYPE.identityOf("t1", 5L).load(new Tally.Added("t1", T1, 1L, 3));

        Tally copy = tally.identity();

        assertThat(copy).isNotSameAs(tally);
        assertThat(copy.getId()).isEqualTo("t1");
        assertThat(copy.getVersion()).isEqualTo(5L);
        assertThat(copy.getTotal()).isZero();
    }
}
