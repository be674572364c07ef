package com.siteledger.controller;

import com.siteledger.domain.EntryOrder;
import com.siteledger.domain.LedgerEntry;
import com.siteledger.domain.TransactionType;
import com.siteledger.dto.ApiResponses;
import com.siteledger.dto.RecordTransactionRequest;
import com.siteledger.service.HistoryFilter;
import com.siteledger.service.LedgerQueryService;
import com.siteledger.service.TransactionRecorder;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;

/**
 * REST controller for one account's ledger.
 *
 * CONTRACT:
 * - POST /accounts/{id}/transactions → 201 Created | 400 | 404 | 409 | 500 | 503
 * - GET  /accounts/{id}/history      → 200 OK | 400 | 404 (type, from, to, search filters)
 * - GET  /accounts/{id}/summary      → 200 OK | 404
 *
 * RULES:
 * - No business logic in this controller
 * - Writes go through TransactionRecorder only
 */
@RestController
@RequestMapping("/accounts/{accountId}")
@Tag(name = "Ledger", description = "Record transactions and read account history and summary")
public class LedgerController {

    private final TransactionRecorder transactionRecorder;
    private final LedgerQueryService ledgerQueryService;
    private final Clock clock;

    public LedgerController(TransactionRecorder transactionRecorder, LedgerQueryService ledgerQueryService,
                            Clock clock) {
        this.transactionRecorder = transactionRecorder;
        this.ledgerQueryService = ledgerQueryService;
        this.clock = clock;
    }

    @PostMapping("/transactions")
    @Operation(
        summary = "Record transaction",
        description = "Appends one entry. The amount is a magnitude; the sign comes from the transaction type. " +
                      "Only the inventory ADJUSTMENT type takes a signed amount."
    )
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "201", description = "Entry appended"),
        @ApiResponse(responseCode = "400", description = "Invalid amount, type or metadata"),
        @ApiResponse(responseCode = "404", description = "Account not found"),
        @ApiResponse(responseCode = "409", description = "Insufficient stock or account halted"),
        @ApiResponse(responseCode = "500", description = "Consistency violation; account halted"),
        @ApiResponse(responseCode = "503", description = "Account busy; retry later")
    })
    public ResponseEntity<ApiResponses.EntryResponse> record(
            @PathVariable Long accountId,
            @Valid @RequestBody RecordTransactionRequest request) {
        Instant occurredAt = request.getOccurredAt() != null ? request.getOccurredAt() : clock.instant();
        LedgerEntry entry = transactionRecorder.record(accountId, request.getType(), request.getAmount(),
                occurredAt, request.toMetadata());
        return ResponseEntity.status(HttpStatus.CREATED).body(new ApiResponses.EntryResponse(entry));
    }

    @GetMapping("/history")
    @Operation(summary = "Account history",
               description = "Paginated entries with running balance and derived status per entry, " +
                             "optionally filtered by type, transaction date range and text.")
    public ResponseEntity<ApiResponses.HistoryResponse> history(
            @PathVariable Long accountId,
            @Parameter(description = "1-based page number") @RequestParam(defaultValue = "1") int page,
            @Parameter(description = "Entries per page, 1 to 100") @RequestParam(defaultValue = "20") int size,
            @Parameter(description = "CHRONOLOGICAL (default) or SEQUENCE")
            @RequestParam(defaultValue = "CHRONOLOGICAL") EntryOrder order,
            @Parameter(description = "Only entries of this type") @RequestParam(required = false) TransactionType type,
            @Parameter(description = "Earliest transaction date, inclusive")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @Parameter(description = "Latest transaction date, inclusive")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @Parameter(description = "Text contained in the reference or description")
            @RequestParam(required = false) String search) {
        return ResponseEntity.ok(new ApiResponses.HistoryResponse(ledgerQueryService.history(
                accountId, page, size, order, HistoryFilter.of(type, from, to, search))));
    }

    @GetMapping("/summary")
    @Operation(summary = "Account summary",
               description = "Totals, current balance and derived payment or stock status.")
    public ResponseEntity<ApiResponses.SummaryResponse> summary(@PathVariable Long accountId) {
        return ResponseEntity.ok(new ApiResponses.SummaryResponse(ledgerQueryService.summary(accountId)));
    }
}
