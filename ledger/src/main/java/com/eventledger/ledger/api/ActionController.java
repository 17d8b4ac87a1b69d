package com.eventledger.ledger.api;

import com.eventledger.core.action.Action;
import com.eventledger.core.event.RecordedEvent;
import com.eventledger.ledger.service.LedgerCommandService;
import com.eventledger.ledger.service.LedgerQueryService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Action REST Controller
 *
 * Record: POST /api/actions/{deposits|withdrawals|transfers}, optionally backdated with effectiveAt.
 * Correct: PUT /api/actions/{id}/{deposit|withdrawal|transfer}, DELETE /api/actions/{id}.
 * Corrections replay every later event of the involved accounts in the same transaction.
 */
@Slf4j
@RestController
@RequestMapping("/api/actions")
@RequiredArgsConstructor
public class ActionController {

    private final LedgerCommandService commandService;
    private final LedgerQueryService queryService;

    // ─── Record ───────────────────────────────────────────────────────────────

    /**
     * POST /api/actions/deposits
     */
    @PostMapping("/deposits")
    public ResponseEntity<ActionResponse> recordDeposit(@Valid @RequestBody SingleAccountActionRequest request) {
        Action action = commandService.recordDeposit(
                request.getAccountId(), request.getAmount(), request.getEffectiveAt());
        return created(action);
    }

    /**
     * POST /api/actions/withdrawals
     */
    @PostMapping("/withdrawals")
    public ResponseEntity<ActionResponse> recordWithdrawal(@Valid @RequestBody SingleAccountActionRequest request) {
        Action action = commandService.recordWithdrawal(
                request.getAccountId(), request.getAmount(), request.getEffectiveAt());
        return created(action);
    }

    /**
     * POST /api/actions/transfers
     */
    @PostMapping("/transfers")
    public ResponseEntity<ActionResponse> recordTransfer(@Valid @RequestBody TransferRequest request) {
        Action action = commandService.recordTransfer(
                request.getFromAccountId(), request.getToAccountId(), request.getAmount(), request.getEffectiveAt());
        return created(action);
    }

    // ─── Correct ──────────────────────────────────────────────────────────────

    /**
     * PUT /api/actions/{actionId}/deposit
     * Replaces the deposit's details; its effective time and id are kept.
     */
    @PutMapping("/{actionId}/deposit")
    public ResponseEntity<ActionResponse> editDeposit(@PathVariable long actionId,
                                                      @Valid @RequestBody SingleAccountActionRequest request) {
        return ResponseEntity.ok(ActionResponse.of(
                commandService.editDeposit(actionId, request.getAccountId(), request.getAmount())));
    }

    @PutMapping("/{actionId}/withdrawal")
    public ResponseEntity<ActionResponse> editWithdrawal(@PathVariable long actionId,
                                                         @Valid @RequestBody SingleAccountActionRequest request) {
        return ResponseEntity.ok(ActionResponse.of(
                commandService.editWithdrawal(actionId, request.getAccountId(), request.getAmount())));
    }

    @PutMapping("/{actionId}/transfer")
    public ResponseEntity<ActionResponse> editTransfer(@PathVariable long actionId,
                                                       @Valid @RequestBody TransferRequest request) {
        return ResponseEntity.ok(ActionResponse.of(commandService.editTransfer(
                actionId, request.getFromAccountId(), request.getToAccountId(), request.getAmount())));
    }

    /**
     * DELETE /api/actions/{actionId}
     */
    @DeleteMapping("/{actionId}")
    public ResponseEntity<ActionResponse> deleteAction(@PathVariable long actionId) {
        return ResponseEntity.ok(ActionResponse.of(commandService.deleteAction(actionId)));
    }

    // ─── Read ─────────────────────────────────────────────────────────────────

    /**
     * GET /api/actions/{actionId}
     */
    @GetMapping("/{actionId}")
    public ResponseEntity<ActionResponse> getAction(@PathVariable long actionId) {
        return ResponseEntity.ok(ActionResponse.of(queryService.getAction(actionId)));
    }

    /**
     * GET /api/actions/{actionId}/events
     * Account events of every revision of the action; superseded ones are flagged tombstoned.
     */
    @GetMapping("/{actionId}/events")
    public ResponseEntity<Map<String, Object>> getActionEvents(@PathVariable long actionId) {
        List<RecordedEvent> recorded = queryService.actionEvents(actionId);
        List<EventResponse> events = recorded.stream().map(EventResponse::of).toList();
        return ResponseEntity.ok(Map.of(
                "actionId", Action.idOf(actionId),
                "events", events,
                "count", events.size()
        ));
    }

    private static ResponseEntity<ActionResponse> created(Action action) {
        return ResponseEntity
                .created(URI.create("/api/actions/" + Action.idOf(action.getSequenceNumber())))
                .body(ActionResponse.of(action));
    }
}

// ─── Request DTOs ──────────────────────────────────────────────────────────────

@Data
class SingleAccountActionRequest {
    @NotBlank private String accountId;
    @NotNull @Positive private BigDecimal amount;
    private Instant effectiveAt;
}

@Data
class TransferRequest {
    @NotBlank private String fromAccountId;
    @NotBlank private String toAccountId;
    @NotNull @Positive private BigDecimal amount;
    private Instant effectiveAt;
}
