package com.eventledger.core.event;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class EventPositionTest {

    private static final Instant T = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    @DisplayName("Total order - time first, then sequence nulls first, then insertion id")
    void ordersByTimeThenSequenceThenInsertion() {
        EventPosition later = new EventPosition(T.plusSeconds(1), null, 1L);
        EventPosition sequenced2 = new EventPosition(T, 2L, 3L);
        EventPosition sequenced1b = new EventPosition(T, 1L, 9L);
        EventPosition sequenced1a = new EventPosition(T, 1L, 4L);
        EventPosition unsequenced = new EventPosition(T, null, 10L);

        List<EventPosition> positions = new ArrayList<>(List.of(later, sequenced2, sequenced1b, sequenced1a, unsequenced));
        positions.sort(EventPosition.ORDER);

        assertThat(positions).containsExactly(unsequenced, sequenced1a, sequenced1b, sequenced2, later);
    }

    @Test
    @DisplayName("Unwritten position sorts after written ones at the same time and sequence")
    void unwrittenSortsLast() {
        EventPosition written = new EventPosition(T, 5L, 100L);
        EventPosition unwritten = new EventPosition(T, 5L, null);

        assertThat(unwritten).isGreaterThan(written);
    }

    @Test
    @DisplayName("isStrictlyBefore - unsequenced events at the point's instant precede it")
    void strictlyBefore() {
        assertThat(new EventPosition(T, null, 1L).isStrictlyBefore(T, 5L)).isTrue();
        assertThat(new EventPosition(T, 4L, 1L).isStrictlyBefore(T, 5L)).isTrue();
        assertThat(new EventPosition(T, 5L, 1L).isStrictlyBefore(T, 5L)).isFalse();
        assertThat(new EventPosition(T, 6L, 1L).isStrictlyBefore(T, 5L)).isFalse();
        assertThat(new EventPosition(T.minusMillis(1), 99L, 1L).isStrictlyBefore(T, 5L)).isTrue();
    }

    @Test
    @DisplayName("isStrictlyAfter - the point itself and unsequenced events at its instant are excluded")
    void strictlyAfter() {
        assertThat(new EventPosition(T, null, 1L).isStrictlyAfter(T, 5L)).isFalse();
        assertThat(new EventPosition(T, 5L, 1L).isStrictlyAfter(T, 5L)).isFalse();
        assertThat(new EventPosition(T, 6L, 1L).isStrictlyAfter(T, 5L)).isTrue();
        assertThat(new EventPosition(T.plusMillis(1), null, 1L).isStrictlyAfter(T, 5L)).isTrue();
    }
}
