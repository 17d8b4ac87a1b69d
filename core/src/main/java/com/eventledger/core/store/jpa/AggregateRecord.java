package com.eventledger.core.store.jpa;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Aggregate Row: current snapshot of one aggregate.
 *
 * version is the compare-and-swap token. It is only ever advanced by
 * AggregateRecordRepository.compareAndSet, never through entity dirty checking.
 */
@Entity
@Table(name = "aggregates")
@IdClass(AggregateRecord.Key.class)
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AggregateRecord {

    @Id
    @Column(name = "aggregate_type", length = 50)
    private String aggregateType;

    @Id
    @Column(name = "aggregate_id", length = 64)
    private String aggregateId;

    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "state", nullable = false, length = 8192)
    private String state;              // Aggregate JSON as of the last persist

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode
    public static class Key implements Serializable {
        private static final long serialVersionUID = 1L;

        private String aggregateType;
        private String aggregateId;
    }
}
