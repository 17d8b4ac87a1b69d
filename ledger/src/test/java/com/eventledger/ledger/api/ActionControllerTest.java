package com.eventledger.ledger.api;

import com.eventledger.core.action.Action;
import com.eventledger.core.action.ActionDetails;
import com.eventledger.core.action.ActionEvents.ActionRecorded;
import com.eventledger.core.exception.ActionNotFoundException;
import com.eventledger.core.exception.ReplayInconsistencyException;
import com.eventledger.ledger.domain.InsufficientFundsException;
import com.eventledger.ledger.domain.LedgerActions.DepositDetails;
import com.eventledger.ledger.domain.LedgerActions.TransferDetails;
import com.eventledger.ledger.service.LedgerCommandService;
import com.eventledger.ledger.service.LedgerQueryService;
import com.eventledger.ledger.support.LedgerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.time.Instant;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web Tests - ActionController with LedgerExceptionHandler, services mocked
 */
@ExtendWith(MockitoExtension.class)
class ActionControllerTest {

    private static final long ACTION_ID = 7_000_000_000_001L;
    private static final Instant EFFECTIVE_AT = Instant.parse("2024-05-01T09:00:00Z");

    @Mock LedgerCommandService commandService;
    @Mock LedgerQueryService queryService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new ActionController(commandService, queryService))
                .setControllerAdvice(new LedgerExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(LedgerFixture.objectMapper()))
                .build();
    }

    private static Action action(ActionDetails details) {
        return Action.TYPE.newInstance().load(
                new ActionRecorded(Action.idOf(ACTION_ID), EFFECTIVE_AT, ACTION_ID, EFFECTIVE_AT, details));
    }

    // ─── Record ───────────────────────────────────────────────────────────────

    @Test
    @DisplayName("POST /deposits - 201 with the action id as a string")
    void recordDeposit() throws Exception {
        when(commandService.recordDeposit("acc_1", new BigDecimal("25.50"), null))
                .thenReturn(action(new DepositDetails("acc_1", new BigDecimal("25.50"))));

        mockMvc.perform(post("/api/actions/deposits")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"accountId\":\"acc_1\",\"amount\":25.50}"))
                .andExpect(status().isCreated())
                .andExpect(header().string("Location", "/api/actions/7000000000001"))
                .andExpect(jsonPath("$.actionId").value("7000000000001"))
                .andExpect(jsonPath("$.actionType").value("deposit"))
                .andExpect(jsonPath("$.details.actionType").value("deposit"))
                .andExpect(jsonPath("$.revisionNumber").value(1));
    }

    @Test
    @DisplayName("POST /withdrawals - effectiveAt is passed through for backdating")
    void recordBackdatedWithdrawal() throws Exception {
        when(commandService.recordWithdrawal(eq("acc_1"), any(), eq(EFFECTIVE_AT)))
                .thenReturn(action(new DepositDetails("acc_1", BigDecimal.TEN)));

        mockMvc.perform(post("/api/actions/withdrawals")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"accountId\":\"acc_1\",\"amount\":10,\"effectiveAt\":\"2024-05-01T09:00:00Z\"}"))
                .andExpect(status().isCreated());

        verify(commandService).recordWithdrawal("acc_1", new BigDecimal("10"), EFFECTIVE_AT);
    }

    @Test
    @DisplayName("POST /transfers - invalid body is a 400 with field errors")
    void invalidTransfer() throws Exception {
        mockMvc.perform(post("/api/actions/transfers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fromAccountId\":\"acc_1\",\"amount\":-5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.validationErrors.toAccountId").exists())
                .andExpect(jsonPath("$.validationErrors.amount").exists());

        verifyNoInteractions(commandService);
    }

    // ─── Correct ──────────────────────────────────────────────────────────────

    @Test
    @DisplayName("PUT /{id}/transfer - returns the new revision")
    void editTransfer() throws Exception {
        when(commandService.editTransfer(ACTION_ID, "acc_1", "acc_3", new BigDecimal("5")))
                .thenReturn(action(new TransferDetails("acc_1", "acc_3", new BigDecimal("5"))));

        mockMvc.perform(put("/api/actions/{id}/transfer", ACTION_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fromAccountId\":\"acc_1\",\"toAccountId\":\"acc_3\",\"amount\":5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accountIds[1]").value("acc_3"));
    }

    @Test
    @DisplayName("PUT /{id}/deposit - a correction that overdraws later history is a 422")
    void editOverdraws() throws Exception {
        when(commandService.editDeposit(ACTION_ID, "acc_1", new BigDecimal("1")))
                .thenThrow(new InsufficientFundsException("acc_1", BigDecimal.ONE, BigDecimal.TEN, 99L));

        mockMvc.perform(put("/api/actions/{id}/deposit", ACTION_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"accountId\":\"acc_1\",\"amount\":1}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("Insufficient funds"));
    }

    @Test
    @DisplayName("DELETE /{id} - unknown action is a 404, a second delete is a 409")
    void deleteErrors() throws Exception {
        when(commandService.deleteAction(1L)).thenThrow(new ActionNotFoundException(1L));
        when(commandService.deleteAction(2L)).thenThrow(new IllegalStateException("Action 2 has already been deleted"));

        mockMvc.perform(delete("/api/actions/1")).andExpect(status().isNotFound());
        mockMvc.perform(delete("/api/actions/2"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("Action 2 has already been deleted"));
    }

    @Test
    @DisplayName("corrupt history surfaces as a 500")
    void replayInconsistency() throws Exception {
        when(commandService.deleteAction(3L)).thenThrow(new ReplayInconsistencyException("out of order"));

        mockMvc.perform(delete("/api/actions/3"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Replay inconsistency"));
    }
}
