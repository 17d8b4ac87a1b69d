package com.eventledger.core.store.jpa;

import com.eventledger.core.exception.VersionConflictException;
import com.eventledger.core.store.EventCodec;
import com.eventledger.core.support.EventSourcingFixture;
import com.eventledger.core.support.Tally;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DataJpaTest
class JpaAggregateStoreTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Autowired StoredEventRepository eventRepository;
    @Autowired AggregateRecordRepository recordRepository;

    JpaAggregateStore<Tally> store;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        EventCodec codec = new EventCodec(EventSourcingFixture.objectMapper());
        JpaEventStore eventStore = new JpaEventStore(Tally.TYPE, eventRepository, codec, clock);
        store = new JpaAggregateStore<>(Tally.TYPE, eventStore, codec, recordRepository, clock);
    }

    private static Tally unsaved(String id) {
        return Tally.TYPE.identityOf(id, 0L).load(new Tally.Opened(id, "tally " + id));
    }

    @Test
    @DisplayName("persist - insert at version 1, then compare-and-swap to version 2")
    void insertThenCompareAndSwap() {
        Tally tally = unsaved("t1");
        store.persist(tally);
        store.persist(tally);

        assertThat(store.currentVersion("t1")).contains(2L);
        assertThat(store.findSnapshot("t1")).hasValueSatisfying(json -> assertThat(json).contains("tally t1"));
    }

    @Test
    @DisplayName("persist - stale version updates no row and conflicts")
    void staleVersionConflicts() {
        store.persist(unsaved("t1"));
        store.persist(Tally.TYPE.identityOf("t1", 1L));

        assertThatThrownBy(() -> store.persist(Tally.TYPE.identityOf("t1", 1L)))
                .isInstanceOf(VersionConflictException.class);
        assertThat(store.currentVersion("t1")).contains(2L);
    }

    @Test
    @DisplayName("persist - a taken id cannot be inserted again")
    void duplicateInsertConflicts() {
        store.persist(unsaved("t1"));

        assertThatThrownBy(() -> store.persist(unsaved("t1")))
                .isInstanceOf(VersionConflictException.class);
    }

    @Test
    @DisplayName("find - rebuilds from the event table at the stored version")
    void findFoldsEvents() {
        store.eventStore().append(List.of(new Tally.Opened("t1", "groceries"), new Tally.Added("t1", NOW, 3L, 4)));
        store.persist(unsaved("t1"));

        assertThat(store.find("t1")).hasValueSatisfying(tally -> {
            assertThat(tally.getTotal()).isEqualTo(4);
            assertThat(tally.getName()).isEqualTo("groceries");
            assertThat(tally.getVersion()).isEqualTo(1L);
        });
    }

    @Test
    @DisplayName("findIdsAfter / count - cursor paging scoped to the aggregate type")
    void pagesIds() {
        List.of("c", "a", "b").forEach(id -> store.persist(unsaved(id)));

        assertThat(store.findIdsAfter(null, 2)).containsExactly("a", "b");
        assertThat(store.findIdsAfter("b", 2)).containsExactly("c");
        assertThat(store.count()).isEqualTo(3);
    }
}
