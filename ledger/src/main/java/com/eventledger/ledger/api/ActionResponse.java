package com.eventledger.ledger.api;

import com.eventledger.core.action.Action;
import com.eventledger.core.action.ActionDetails;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Wire view of an action. The id is a string: action ids exceed the range
 * JavaScript clients can hold exactly.
 */
@Data
@Builder
public class ActionResponse {

    private String actionId;
    private String actionType;
    private Instant effectiveAt;
    private Instant recordedAt;
    private Instant updatedAt;
    private Instant deletedAt;
    private int revisionNumber;
    private boolean deleted;
    private ActionDetails details;
    private List<String> accountIds;

    public static ActionResponse of(Action action) {
        return ActionResponse.builder()
                .actionId(Action.idOf(action.getSequenceNumber()))
                .actionType(action.getActionType())
                .effectiveAt(action.getEffectiveAt())
                .recordedAt(action.getRecordedAt())
                .updatedAt(action.getUpdatedAt())
                .deletedAt(action.getDeletedAt())
                .revisionNumber(action.getRevisionNumber())
                .deleted(action.isDeleted())
                .details(action.getDetails())
                .accountIds(action.getInvolvedAggregateIds())
                .build();
    }
}
