package com.eventledger.core.store.jpa;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface AggregateRecordRepository extends JpaRepository<AggregateRecord, AggregateRecord.Key> {

    @Query("SELECT r.version FROM AggregateRecord r WHERE r.aggregateType = :type AND r.aggregateId = :id")
    Optional<Long> findVersion(@Param("type") String aggregateType, @Param("id") String aggregateId);

    @Query("SELECT r.state FROM AggregateRecord r WHERE r.aggregateType = :type AND r.aggregateId = :id")
    Optional<String> findState(@Param("type") String aggregateType, @Param("id") String aggregateId);

    /**
     * Compare-and-swap on (id, version). Returns the number of rows updated: 1 or 0.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE AggregateRecord r SET r.version = r.version + 1, r.state = :state, r.updatedAt = :now"
            + " WHERE r.aggregateType = :type AND r.aggregateId = :id AND r.version = :expected")
    int compareAndSet(@Param("type") String aggregateType,
                      @Param("id") String aggregateId,
                      @Param("expected") long expectedVersion,
                      @Param("state") String state,
                      @Param("now") Instant now);

    @Query("SELECT r.aggregateId FROM AggregateRecord r WHERE r.aggregateType = :type"
            + " AND r.aggregateId > :after ORDER BY r.aggregateId ASC")
    List<String> findIdsAfter(@Param("type") String aggregateType, @Param("after") String afterId, Pageable page);

    @Query("SELECT r.aggregateId FROM AggregateRecord r WHERE r.aggregateType = :type ORDER BY r.aggregateId ASC")
    List<String> findFirstIds(@Param("type") String aggregateType, Pageable page);

    long countByAggregateType(String aggregateType);
}
