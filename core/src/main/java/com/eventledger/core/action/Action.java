package com.eventledger.core.action;

import com.eventledger.core.action.ActionEvents.ActionDeleted;
import com.eventledger.core.action.ActionEvents.ActionEdited;
import com.eventledger.core.action.ActionEvents.ActionRecorded;
import com.eventledger.core.aggregate.AggregateRoot;
import com.eventledger.core.aggregate.AggregateType;
import com.eventledger.core.event.ValueChange;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Action: one user-initiated causal operation.
 *
 * The action's sequence number is stamped on every domain event it produces, and its
 * effective time becomes their occurredAt. Editing or deleting an action rewinds the
 * involved aggregates to just before that (effectiveAt, sequenceNumber) point.
 *
 * Lifecycle: recorded (revision 1) → edited (revision n+1)* → deleted (terminal).
 */
@Getter
public class Action extends AggregateRoot<Action> {

    public static final AggregateType<Action> TYPE = AggregateType.<Action>builder("action", Action::new)
            .on(ActionEvents.ACTION_RECORDED, ActionRecorded.class, Action::onRecorded)
            .on(ActionEvents.ACTION_EDITED, ActionEdited.class, Action::onEdited)
            .on(ActionEvents.ACTION_DELETED, ActionDeleted.class, Action::onDeleted)
            .build();

    private long sequenceNumber;
    private String actionType;
    private Instant effectiveAt;
    private Instant recordedAt;
    private Instant updatedAt;
    private Instant deletedAt;
    private int revisionNumber;
    private ActionDetails details;

    protected Action() {
    }

    @Override
    public AggregateType<Action> aggregateType() {
        return TYPE;
    }

    public static String idOf(long sequenceNumber) {
        return Long.toString(sequenceNumber);
    }

    // ─── Behaviour ────────────────────────────────────────────────────────────

    public static Action record(long sequenceNumber, Instant effectiveAt, Instant recordedAt, ActionDetails details) {
        Objects.requireNonNull(effectiveAt, "effectiveAt");
        Objects.requireNonNull(details, "details");
        Action action = new Action();
        action.apply(new ActionRecorded(idOf(sequenceNumber), recordedAt, sequenceNumber, effectiveAt, details));
        return action;
    }

    public void edit(ActionDetails newDetails, Instant editedAt) {
        checkEditable(newDetails);
        apply(new ActionEdited(getId(), editedAt, revisionNumber + 1, new ValueChange<>(details, newDetails)));
    }

    public void delete(Instant at) {
        if (isDeleted()) {
            throw new IllegalStateException("Action " + getId() + " has already been deleted");
        }
        apply(new ActionDeleted(getId(), at));
    }

    public void checkEditable(ActionDetails newDetails) {
        if (isDeleted()) {
            throw new IllegalStateException("Cannot edit action " + getId() + ": it has been deleted");
        }
        if (!actionType.equals(newDetails.getActionType())) {
            throw new IllegalArgumentException(String.format(
                    "Cannot edit action %s of type %s with %s details", getId(), actionType, newDetails.getActionType()));
        }
    }

    @JsonIgnore
    public boolean isDeleted() {
        return deletedAt != null;
    }

    public List<String> getInvolvedAggregateIds() {
        return details.involvedAggregateIds();
    }

    // ─── Handlers ─────────────────────────────────────────────────────────────

    private void onRecorded(ActionRecorded event) {
        assignId(event.getAggregateId());
        this.sequenceNumber = event.getActionSequence();
        this.actionType = event.getDetails().getActionType();
        this.effectiveAt = event.getEffectiveAt();
        this.recordedAt = event.getOccurredAt();
        this.updatedAt = event.getOccurredAt();
        this.revisionNumber = 1;
        this.details = event.getDetails();
    }

    private void onEdited(ActionEdited event) {
        this.details = event.getDetails().getCurrent();
        this.revisionNumber = event.getRevisionNumber();
        this.updatedAt = event.getOccurredAt();
    }

    private void onDeleted(ActionDeleted event) {
        this.deletedAt = event.getOccurredAt();
        this.updatedAt = event.getOccurredAt();
    }
}
