package com.siteledger.controller;

import com.siteledger.domain.LedgerKind;
import com.siteledger.dto.ApiResponses;
import com.siteledger.service.AlertFilter;
import com.siteledger.service.LedgerQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Cross-account views consumed by the report and dashboard modules.
 */
@RestController
@RequestMapping("/ledger")
@Tag(name = "Ledger views", description = "Summaries of all accounts and the overdue / low-stock listing")
public class LedgerQueryController {

    private final LedgerQueryService ledgerQueryService;

    public LedgerQueryController(LedgerQueryService ledgerQueryService) {
        this.ledgerQueryService = ledgerQueryService;
    }

    @GetMapping("/summaries")
    @Operation(summary = "Summaries of all accounts")
    public ResponseEntity<List<ApiResponses.SummaryResponse>> summaries(
            @Parameter(description = "FINANCIAL or INVENTORY") @RequestParam(required = false) LedgerKind kind) {
        return ResponseEntity.ok(ledgerQueryService.summaries(kind).stream()
                .map(ApiResponses.SummaryResponse::new)
                .collect(Collectors.toList()));
    }

    @GetMapping("/alerts")
    @Operation(summary = "Overdue and low-stock listing",
               description = "Overdue suppliers and materials at or below minimum or reorder point, as of a date.")
    public ResponseEntity<List<ApiResponses.AlertResponse>> alerts(
            @Parameter(description = "FINANCIAL or INVENTORY") @RequestParam(required = false) LedgerKind kind,
            @Parameter(description = "Evaluation date, defaults to today")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return ResponseEntity.ok(ledgerQueryService.overdueOrLowStock(AlertFilter.of(kind, asOf)).stream()
                .map(ApiResponses.AlertResponse::new)
                .collect(Collectors.toList()));
    }
}
