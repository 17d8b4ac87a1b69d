package com.eventledger.core.store.jpa;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface StoredEventRepository extends JpaRepository<StoredEvent, Long> {

    String TOTAL_ORDER = " ORDER BY e.occurredAt ASC, e.sequenceNumber ASC NULLS FIRST, e.insertionId ASC";

    @Query("SELECT e FROM StoredEvent e WHERE e.aggregateType = :type AND e.aggregateId IN :ids"
            + " AND e.tombstonedAt IS NULL" + TOTAL_ORDER)
    List<StoredEvent> findLive(@Param("type") String aggregateType,
                               @Param("ids") Collection<String> aggregateIds);

    @Query("SELECT e FROM StoredEvent e WHERE e.aggregateType = :type AND e.aggregateId IN :ids"
            + " AND e.tombstonedAt IS NULL AND e.occurredAt <= :cutoff" + TOTAL_ORDER)
    List<StoredEvent> findLiveUpTo(@Param("type") String aggregateType,
                                   @Param("ids") Collection<String> aggregateIds,
                                   @Param("cutoff") Instant cutoff);

    @Query("SELECT e FROM StoredEvent e WHERE e.aggregateType = :type AND e.aggregateId IN :ids"
            + " AND e.tombstonedAt IS NULL AND e.occurredAt < :occurredAt" + TOTAL_ORDER)
    List<StoredEvent> findLiveBeforeTime(@Param("type") String aggregateType,
                                         @Param("ids") Collection<String> aggregateIds,
                                         @Param("occurredAt") Instant occurredAt);

    @Query("SELECT e FROM StoredEvent e WHERE e.aggregateType = :type AND e.aggregateId IN :ids"
            + " AND e.tombstonedAt IS NULL"
            + " AND (e.occurredAt < :occurredAt OR (e.occurredAt = :occurredAt"
            + "      AND (e.sequenceNumber IS NULL OR e.sequenceNumber < :sequenceNumber)))" + TOTAL_ORDER)
    List<StoredEvent> findLiveBeforePoint(@Param("type") String aggregateType,
                                          @Param("ids") Collection<String> aggregateIds,
                                          @Param("occurredAt") Instant occurredAt,
                                          @Param("sequenceNumber") Long sequenceNumber);

    @Query("SELECT e FROM StoredEvent e WHERE e.aggregateType = :type AND e.aggregateId = :id"
            + " AND e.tombstonedAt IS NULL"
            + " AND (e.occurredAt > :occurredAt OR (e.occurredAt = :occurredAt"
            + "      AND e.sequenceNumber IS NOT NULL AND e.sequenceNumber > :sequenceNumber))" + TOTAL_ORDER)
    List<StoredEvent> findLiveAfterPoint(@Param("type") String aggregateType,
                                         @Param("id") String aggregateId,
                                         @Param("occurredAt") Instant occurredAt,
                                         @Param("sequenceNumber") Long sequenceNumber);

    @Query("SELECT e FROM StoredEvent e WHERE e.aggregateType = :type AND e.sequenceNumber = :sequenceNumber"
            + TOTAL_ORDER)
    List<StoredEvent> findByAction(@Param("type") String aggregateType,
                                   @Param("sequenceNumber") Long sequenceNumber);

    @Query("SELECT e FROM StoredEvent e WHERE e.aggregateType = :type AND e.aggregateId = :id"
            + " AND e.tombstonedAt IS NULL" + TOTAL_ORDER)
    List<StoredEvent> findLiveHead(@Param("type") String aggregateType,
                                   @Param("id") String aggregateId,
                                   Pageable page);

    @Query("SELECT e FROM StoredEvent e WHERE e.aggregateType = :type AND e.aggregateId = :id"
            + " AND e.tombstonedAt IS NULL"
            + " AND (e.sequenceNumber IS NULL OR e.sequenceNumber <> :sequenceNumber)" + TOTAL_ORDER)
    List<StoredEvent> findLiveHeadExcluding(@Param("type") String aggregateType,
                                            @Param("id") String aggregateId,
                                            @Param("sequenceNumber") Long sequenceNumber,
                                            Pageable page);

    @Query("SELECT e FROM StoredEvent e WHERE e.aggregateType = :type AND e.aggregateId = :id" + TOTAL_ORDER)
    List<StoredEvent> findAuditTrail(@Param("type") String aggregateType,
                                     @Param("id") String aggregateId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE StoredEvent e SET e.tombstonedAt = :at"
            + " WHERE e.aggregateType = :type AND e.insertionId IN :ids AND e.tombstonedAt IS NULL")
    int tombstone(@Param("type") String aggregateType,
                  @Param("ids") Collection<Long> insertionIds,
                  @Param("at") Instant at);
}
