package com.eventledger.ledger.api;

import com.eventledger.core.event.RecordedEvent;
import com.eventledger.ledger.domain.Account;
import com.eventledger.ledger.projection.AccountSnapshot;
import com.eventledger.ledger.projection.LedgerSources;
import com.eventledger.ledger.service.LedgerCommandService;
import com.eventledger.ledger.service.LedgerQueryService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Account REST Controller
 *
 * Write endpoints: POST /api/accounts, PATCH /api/accounts/{id}/name, POST /api/accounts/{id}/close
 *   → LedgerCommandService → unit of work → event store + aggregate store
 *
 * Read endpoints: GET /api/accounts/{id}, GET /api/accounts/{id}/balance, GET /api/accounts/{id}/events
 *   → LedgerQueryService → Redis (current) or replay (historical)
 */
@Slf4j
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final LedgerCommandService commandService;
    private final LedgerQueryService queryService;

    // ─── Write Endpoints ──────────────────────────────────────────────────────

    /**
     * POST /api/accounts
     */
    @PostMapping
    public ResponseEntity<AccountSnapshot> openAccount(@Valid @RequestBody OpenAccountRequest request) {
        Account account = commandService.openAccount(request.getName());
        return ResponseEntity
                .created(URI.create("/api/accounts/" + account.getId()))
                .body(AccountSnapshot.of(account, LedgerSources.EVENT_STORE));
    }

    /**
     * PATCH /api/accounts/{accountId}/name
     * Optional expectedVersion turns the rename into a compare-and-swap.
     */
    @PatchMapping("/{accountId}/name")
    public ResponseEntity<AccountSnapshot> renameAccount(@PathVariable String accountId,
                                                         @Valid @RequestBody RenameAccountRequest request) {
        Account account = commandService.renameAccount(accountId, request.getName(), request.getExpectedVersion());
        return ResponseEntity.ok(AccountSnapshot.of(account, LedgerSources.EVENT_STORE));
    }

    /**
     * POST /api/accounts/{accountId}/close
     */
    @PostMapping("/{accountId}/close")
    public ResponseEntity<AccountSnapshot> closeAccount(@PathVariable String accountId,
                                                        @RequestParam(required = false) Long expectedVersion) {
        Account account = commandService.closeAccount(accountId, expectedVersion);
        return ResponseEntity.ok(AccountSnapshot.of(account, LedgerSources.EVENT_STORE));
    }

    // ─── Read Endpoints ───────────────────────────────────────────────────────

    /**
     * GET /api/accounts/{accountId}
     */
    @GetMapping("/{accountId}")
    public ResponseEntity<AccountSnapshot> getAccount(@PathVariable String accountId) {
        return ResponseEntity.ok(queryService.getAccount(accountId));
    }

    /**
     * GET /api/accounts/{accountId}/balance?asOf=... or ?before=...
     * Historical balance replayed from the event store. Without either parameter, the current balance.
     */
    @GetMapping("/{accountId}/balance")
    public ResponseEntity<Map<String, Object>> getBalance(
            @PathVariable String accountId,
            @RequestParam(required = false) Instant asOf,
            @RequestParam(required = false) Instant before) {

        if (asOf != null && before != null) {
            throw new IllegalArgumentException("Specify at most one of asOf and before");
        }
        AccountSnapshot snapshot;
        if (asOf != null) {
            snapshot = queryService.accountAsOf(accountId, asOf);
        } else if (before != null) {
            snapshot = queryService.accountBefore(accountId, before);
        } else {
            snapshot = queryService.getAccount(accountId);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("accountId", accountId);
        body.put("balance", snapshot.getBalance());
        body.put("status", snapshot.getStatus());
        if (asOf != null) {
            body.put("asOf", asOf);
        }
        if (before != null) {
            body.put("before", before);
        }
        return ResponseEntity.ok(body);
    }

    /**
     * GET /api/accounts/{accountId}/events
     * Full audit trail, including events superseded by corrections.
     */
    @GetMapping("/{accountId}/events")
    public ResponseEntity<Map<String, Object>> getAccountEvents(@PathVariable String accountId) {
        List<RecordedEvent> trail = queryService.auditTrail(accountId);
        List<EventResponse> events = trail.stream().map(EventResponse::of).toList();
        return ResponseEntity.ok(Map.of(
                "accountId", accountId,
                "events", events,
                "count", events.size()
        ));
    }
}

// ─── Request DTOs ──────────────────────────────────────────────────────────────

@Data
class OpenAccountRequest {
    @NotBlank @Size(max = 200) private String name;
}

@Data
class RenameAccountRequest {
    @NotBlank @Size(max = 200) private String name;
    private Long expectedVersion;
}
