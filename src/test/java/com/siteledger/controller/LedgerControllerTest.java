package com.siteledger.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.siteledger.domain.EntryOrder;
import com.siteledger.domain.LedgerEntry;
import com.siteledger.domain.PaymentStatus;
import com.siteledger.domain.TransactionType;
import com.siteledger.dto.RecordTransactionRequest;
import com.siteledger.exception.AccountHaltedException;
import com.siteledger.exception.AccountNotFoundException;
import com.siteledger.exception.ConcurrentLedgerModificationException;
import com.siteledger.exception.ConsistencyViolationException;
import com.siteledger.exception.InsufficientStockException;
import com.siteledger.exception.InvalidAmountException;
import com.siteledger.exception.LedgerValidationException;
import com.siteledger.service.EntryView;
import com.siteledger.service.HistoryFilter;
import com.siteledger.service.HistoryPage;
import com.siteledger.service.LedgerQueryService;
import com.siteledger.service.TransactionRecorder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Controller slice tests: HTTP contract and error mapping.
 * No database. No full Spring context.
 */
@WebMvcTest(LedgerController.class)
class LedgerControllerTest {

    static final Instant NOW = Instant.parse("2026-03-15T12:00:00Z");

    @TestConfiguration
    static class FixedClock {
        @Bean
        Clock ledgerClock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired MockMvc      mockMvc;
    @Autowired ObjectMapper objectMapper;

    @MockBean TransactionRecorder transactionRecorder;
    @MockBean LedgerQueryService  ledgerQueryService;

    private LedgerEntry purchase() {
        return LedgerEntry.builder()
                .accountId(1L).entryNumber(1).transactionType(TransactionType.PURCHASE)
                .delta(new BigDecimal("1000")).balanceAfter(new BigDecimal("1000"))
                .occurredAt(NOW).recordedAt(NOW)
                .reference("INV-7")
                .build();
    }

    private String body(TransactionType type, String amount) throws Exception {
        return objectMapper.writeValueAsString(
                new RecordTransactionRequest(type, amount != null ? new BigDecimal(amount) : null, null));
    }

    // ── record ────────────────────────────────────────────────────────────────

    @Test @DisplayName("POST transactions → 201 with entry, occurredAt defaults to now")
    void recordCreated() throws Exception {
        when(transactionRecorder.record(eq(1L), eq(TransactionType.PURCHASE), any(), eq(NOW), any()))
            .thenReturn(purchase());

        mockMvc.perform(post("/accounts/1/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(TransactionType.PURCHASE, "1000")))
               .andExpect(status().isCreated())
               .andExpect(jsonPath("$.entryNumber").value(1))
               .andExpect(jsonPath("$.type").value("PURCHASE"))
               .andExpect(jsonPath("$.balanceAfter").value(1000))
               .andExpect(jsonPath("$.reference").value("INV-7"));
    }

    @Test @DisplayName("POST transactions with missing type → 400")
    void missingType() throws Exception {
        mockMvc.perform(post("/accounts/1/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(null, "10")))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.type").exists());
        verifyNoInteractions(transactionRecorder);
    }

    @Test @DisplayName("POST transactions with unknown type → 400")
    void unknownType() throws Exception {
        mockMvc.perform(post("/accounts/1/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"REFUND\",\"amount\":10}"))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test @DisplayName("negative payment amount → 400 VALIDATION_ERROR")
    void negativeAmount() throws Exception {
        when(transactionRecorder.record(any(), any(), any(), any(), any()))
            .thenThrow(new InvalidAmountException(TransactionType.PAYMENT, new BigDecimal("-5"), "must be a magnitude"));

        mockMvc.perform(post("/accounts/1/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(TransactionType.PAYMENT, "-5")))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test @DisplayName("unknown account → 404")
    void accountNotFound() throws Exception {
        when(transactionRecorder.record(any(), any(), any(), any(), any()))
            .thenThrow(new AccountNotFoundException(99L));

        mockMvc.perform(post("/accounts/99/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(TransactionType.PURCHASE, "10")))
               .andExpect(status().isNotFound())
               .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test @DisplayName("over-issue → 409 INSUFFICIENT_STOCK")
    void insufficientStock() throws Exception {
        when(transactionRecorder.record(any(), any(), any(), any(), any()))
            .thenThrow(new InsufficientStockException(2L, new BigDecimal("50"), new BigDecimal("60")));

        mockMvc.perform(post("/accounts/2/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(TransactionType.ISSUE, "60")))
               .andExpect(status().isConflict())
               .andExpect(jsonPath("$.error").value("INSUFFICIENT_STOCK"));
    }

    @Test @DisplayName("halted account → 409 ACCOUNT_HALTED")
    void halted() throws Exception {
        when(transactionRecorder.record(any(), any(), any(), any(), any()))
            .thenThrow(new AccountHaltedException(1L, "drift"));

        mockMvc.perform(post("/accounts/1/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(TransactionType.PURCHASE, "10")))
               .andExpect(status().isConflict())
               .andExpect(jsonPath("$.error").value("ACCOUNT_HALTED"));
    }

    @Test @DisplayName("consistency violation → 500 CONSISTENCY_VIOLATION")
    void consistencyViolation() throws Exception {
        when(transactionRecorder.record(any(), any(), any(), any(), any()))
            .thenThrow(new ConsistencyViolationException(1L, "cache drift"));

        mockMvc.perform(post("/accounts/1/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(TransactionType.PURCHASE, "10")))
               .andExpect(status().isInternalServerError())
               .andExpect(jsonPath("$.error").value("CONSISTENCY_VIOLATION"));
    }

    @Test @DisplayName("retries exhausted → 503 with Retry-After")
    void busy() throws Exception {
        when(transactionRecorder.record(any(), any(), any(), any(), any()))
            .thenThrow(new ConcurrentLedgerModificationException(1L, "Account 1 is busy"));

        mockMvc.perform(post("/accounts/1/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(TransactionType.PURCHASE, "10")))
               .andExpect(status().isServiceUnavailable())
               .andExpect(header().string("Retry-After", "1"))
               .andExpect(jsonPath("$.error").value("CONCURRENT_MODIFICATION"));
    }

    // ── history ───────────────────────────────────────────────────────────────

    @Test @DisplayName("GET history → entries with status and pagination")
    void history() throws Exception {
        HistoryPage page = new HistoryPage(1L, List.of(new EntryView(purchase(), PaymentStatus.PENDING)),
                1, 20, 1, 1, EntryOrder.CHRONOLOGICAL);
        when(ledgerQueryService.history(1L, 1, 20, EntryOrder.CHRONOLOGICAL, HistoryFilter.none())).thenReturn(page);

        mockMvc.perform(get("/accounts/1/history"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.order").value("CHRONOLOGICAL"))
               .andExpect(jsonPath("$.entries[0].status").value("PENDING"))
               .andExpect(jsonPath("$.pagination.totalItems").value(1))
               .andExpect(jsonPath("$.pagination.itemsPerPage").value(20));
    }

    @Test @DisplayName("GET history with page size over limit → 400")
    void historyPageTooLarge() throws Exception {
        when(ledgerQueryService.history(1L, 1, 500, EntryOrder.SEQUENCE, HistoryFilter.none()))
            .thenThrow(new LedgerValidationException("Page size must be between 1 and 100, got 500"));

        mockMvc.perform(get("/accounts/1/history").param("size", "500").param("order", "SEQUENCE"))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test @DisplayName("GET history with type, date range and search → filter handed to the query")
    void historyFiltered() throws Exception {
        HistoryFilter filter = HistoryFilter.of(TransactionType.PAYMENT,
                LocalDate.of(2026, 3, 1), LocalDate.of(2026, 3, 31), "chq");
        when(ledgerQueryService.history(1L, 1, 20, EntryOrder.CHRONOLOGICAL, filter))
            .thenReturn(new HistoryPage(1L, List.of(), 1, 20, 0, 0, EntryOrder.CHRONOLOGICAL));

        mockMvc.perform(get("/accounts/1/history")
                .param("type", "PAYMENT")
                .param("from", "2026-03-01")
                .param("to", "2026-03-31")
                .param("search", "  chq "))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.pagination.totalItems").value(0));
    }

    @Test @DisplayName("GET history with from after to → 400, query not called")
    void historyInvertedRange() throws Exception {
        mockMvc.perform(get("/accounts/1/history").param("from", "2026-04-01").param("to", "2026-03-01"))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
        verifyNoInteractions(ledgerQueryService);
    }

    @Test @DisplayName("GET history with malformed date → 400")
    void historyBadDate() throws Exception {
        mockMvc.perform(get("/accounts/1/history").param("from", "01/03/2026"))
               .andExpect(status().isBadRequest());
    }

    @Test @DisplayName("GET history with unknown order → 400")
    void historyUnknownOrder() throws Exception {
        mockMvc.perform(get("/accounts/1/history").param("order", "RANDOM"))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }
}
