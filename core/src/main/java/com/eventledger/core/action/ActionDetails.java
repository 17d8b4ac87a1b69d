package com.eventledger.core.action;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Domain payload of an {@link Action}.
 *
 * Implementations are immutable and registered as Jackson subtypes by the owning
 * domain (their type id is the {@code actionType} property).
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "actionType")
public interface ActionDetails {

    String getActionType();

    /**
     * Ids of the aggregates this action produces events for.
     */
    List<String> involvedAggregateIds();
}
