package com.eventledger.core.action;

import com.eventledger.core.event.AggregateEvent;
import com.eventledger.core.event.ValueChange;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Events of the {@link Action} aggregate. Action events are never sequenced:
 * an action's own history cannot be edited, only extended.
 */
public final class ActionEvents {

    public static final String ACTION_RECORDED = "action.recorded";
    public static final String ACTION_EDITED = "action.edited";
    public static final String ACTION_DELETED = "action.deleted";

    private ActionEvents() {}

    @Getter
    @ToString(callSuper = true)
    public static class ActionRecorded extends AggregateEvent {
        private final long actionSequence;
        private final Instant effectiveAt;
        private final ActionDetails details;

        @JsonCreator
        public ActionRecorded(@JsonProperty("aggregateId") String aggregateId,
                              @JsonProperty("occurredAt") Instant occurredAt,
                              @JsonProperty("actionSequence") long actionSequence,
                              @JsonProperty("effectiveAt") Instant effectiveAt,
                              @JsonProperty("details") ActionDetails details) {
            super(ACTION_RECORDED, aggregateId, occurredAt, null);
            this.actionSequence = actionSequence;
            this.effectiveAt = effectiveAt;
            this.details = details;
        }
    }

    @Getter
    @ToString(callSuper = true)
    public static class ActionEdited extends AggregateEvent {
        private final int revisionNumber;
        private final ValueChange<ActionDetails> details;

        @JsonCreator
        public ActionEdited(@JsonProperty("aggregateId") String aggregateId,
                            @JsonProperty("occurredAt") Instant occurredAt,
                            @JsonProperty("revisionNumber") int revisionNumber,
                            @JsonProperty("details") ValueChange<ActionDetails> details) {
            super(ACTION_EDITED, aggregateId, occurredAt, null);
            this.revisionNumber = revisionNumber;
            this.details = details;
        }
    }

    @Getter
    @ToString(callSuper = true)
    public static class ActionDeleted extends AggregateEvent {

        @JsonCreator
        public ActionDeleted(@JsonProperty("aggregateId") String aggregateId,
                             @JsonProperty("occurredAt") Instant occurredAt) {
            super(ACTION_DELETED, aggregateId, occurredAt, null);
        }
    }
}
