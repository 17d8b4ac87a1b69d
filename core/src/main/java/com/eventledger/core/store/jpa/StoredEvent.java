package com.eventledger.core.store.jpa;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Aggregate Event Log: append-only, tombstone-aware.
 *
 * One table holds the events of every aggregate type. Rows are never updated except
 * to set tombstoned_at; a correction tombstones the old rows and appends replacements.
 *  - insertion_id:    identity column, final tie-breaker of the total order
 *  - sequence_number: id of the producing action, null for non-editable events
 *  - tombstoned_at:   set when an edit or delete supersedes the row; kept for audit
 */
@Entity
@Table(name = "aggregate_events", indexes = {
    @Index(name = "idx_aggregate_events_stream", columnList = "aggregate_type, aggregate_id, occurred_at"),
    @Index(name = "idx_aggregate_events_action", columnList = "aggregate_type, sequence_number")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "insertion_id")
    private Long insertionId;

    @Column(name = "aggregate_type", nullable = false, length = 50)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false, length = 64)
    private String aggregateId;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    @Column(name = "sequence_number")
    private Long sequenceNumber;

    @Column(name = "payload", nullable = false, length = 8192)
    private String payload;            // Serialized event JSON

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    @Column(name = "tombstoned_at")
    private Instant tombstonedAt;
}
