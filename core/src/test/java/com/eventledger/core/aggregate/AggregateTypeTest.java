package com.eventledger.core.aggregate;

import com.eventledger.core.action.ActionEvents.ActionDeleted;
import com.eventledger.core.exception.UnhandledEventKindException;
import com.eventledger.core.support.Tally;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class AggregateTypeTest {

    // ─── Building ─────────────────────────────────────────────────────────────

    @Test
    @DisplayName("builder - rejects a second handler for the same event kind")
    void rejectsDuplicateKind() {
        AggregateType.Builder<Tally> builder = AggregateType.<Tally>builder("dup", () -> null)
                .on(Tally.OPENED, Tally.Opened.class, (tally, event) -> { });

        assertThatThrownBy(() -> builder.on(Tally.OPENED, Tally.Added.class, (tally, event) -> { }))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(Tally.OPENED);
    }

    @Test
    @DisplayName("builder - rejects the same event class under two kinds")
    void rejectsDuplicateClass() {
        AggregateType.Builder<Tally> builder = AggregateType.<Tally>builder("dup", () -> null)
                .on(Tally.OPENED, Tally.Opened.class, (tally, event) -> { });

        assertThatThrownBy(() -> builder.on("tally.reopened", Tally.Opened.class, (tally, event) -> { }))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("builder - a type without handlers cannot be built")
    void rejectsEmptyTable() {
        assertThatThrownBy(() -> AggregateType.<Tally>builder("empty", () -> null).build())
                .isInstanceOf(IllegalStateException.class);
    }

    // ─── Lookup ───────────────────────────────────────────────────────────────

    @Test
    @DisplayName("eventClass - resolves declared kinds and rejects unknown ones")
    void resolvesEventClasses() {
        assertThat(Tally.TYPE.eventClass(Tally.ADDED)).isEqualTo(Tally.Added.class);
        assertThat(Tally.TYPE.eventTypes()).containsExactly(Tally.OPENED, Tally.ADDED, Tally.DOUBLED);

        assertThatThrownBy(() -> Tally.TYPE.eventClass("tally.halved"))
                .isInstanceOf(UnhandledEventKindException.class)
                .hasMessageContaining("tally.halved");
    }

    @Test
    @DisplayName("handles - only events of the declared kinds")
    void handlesDeclaredKinds() {
        assertThat(Tally.TYPE.handles(new Tally.Opened("t1", "a"))).isTrue();
        assertThat(Tally.TYPE.handles(new ActionDeleted("1", Instant.EPOCH))).isFalse();
    }

    @Test
    @DisplayName("identityOf - blank aggregate with id and version restored")
    void identityOf() {
        Tally tally = Tally.TYPE.identityOf("t1", 4L);

        assertThat(tally.getId()).isEqualTo("t1");
        assertThat(tally.getVersion()).isEqualTo(4L);
        assertThat(tally.getTotal()).isZero();
        assertThat(tally.isNew()).isFalse();
    }

    @Test
    @DisplayName("load - an event of another aggregate type is rejected")
    void rejectsForeignEvent() {
        Tally tally = Tally.TYPE.identityOf("t1", 1L);

        assertThatThrownBy(() -> tally.load(new ActionDeleted("t1", Instant.EPOCH)))
                .isInstanceOf(UnhandledEventKindException.class);
    }
}
