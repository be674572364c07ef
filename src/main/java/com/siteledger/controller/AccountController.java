package com.siteledger.controller;

import com.siteledger.domain.LedgerKind;
import com.siteledger.dto.ApiResponses;
import com.siteledger.dto.OpenFinancialAccountRequest;
import com.siteledger.dto.OpenInventoryAccountRequest;
import com.siteledger.dto.PaymentTermsRequest;
import com.siteledger.dto.ResumeAccountRequest;
import com.siteledger.dto.StockThresholdsRequest;
import com.siteledger.service.AccountService;
import com.siteledger.service.ReconciliationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for account administration.
 *
 * CONTRACT:
 * - POST /accounts/financial          → 201 Created | 400
 * - POST /accounts/inventory          → 201 Created | 400
 * - GET  /accounts?kind=              → 200 OK
 * - GET  /accounts/{id}               → 200 OK | 404
 * - PUT  /accounts/{id}/thresholds    → 200 OK | 400 | 404
 * - PUT  /accounts/{id}/payment-terms → 200 OK | 400 | 404
 * - POST /accounts/{id}/resume        → 200 OK | 404 | 500 if the entry chain is broken
 * - POST /accounts/{id}/reconcile     → 200 OK | 404
 *
 * RULES:
 * - No business logic in this controller
 * - Pure delegation to AccountService and ReconciliationService
 */
@RestController
@RequestMapping("/accounts")
@Tag(name = "Accounts", description = "Supplier and material accounts, halting and reconciliation")
public class AccountController {

    private final AccountService accountService;
    private final ReconciliationService reconciliationService;

    public AccountController(AccountService accountService, ReconciliationService reconciliationService) {
        this.accountService = accountService;
        this.reconciliationService = reconciliationService;
    }

    @PostMapping("/financial")
    @Operation(summary = "Open supplier account",
               description = "Opens a financial ledger for a supplier. Payment terms derive due dates of purchases.")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "201", description = "Account opened"),
        @ApiResponse(responseCode = "400", description = "Invalid request or duplicate code")
    })
    public ResponseEntity<ApiResponses.AccountResponse> openFinancialAccount(
            @Valid @RequestBody OpenFinancialAccountRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(new ApiResponses.AccountResponse(
                accountService.openFinancialAccount(request.getCode(), request.getName(),
                        request.getPaymentTermsDays())));
    }

    @PostMapping("/inventory")
    @Operation(summary = "Open material account",
               description = "Opens an inventory ledger for one material at one location, with stock thresholds.")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "201", description = "Account opened"),
        @ApiResponse(responseCode = "400", description = "Invalid thresholds or duplicate code")
    })
    public ResponseEntity<ApiResponses.AccountResponse> openInventoryAccount(
            @Valid @RequestBody OpenInventoryAccountRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(new ApiResponses.AccountResponse(
                accountService.openInventoryAccount(request.getCode(), request.getName(), request.getLocation(),
                        request.getMinimumStockLevel(), request.getMaximumStockLevel(),
                        request.getReorderPoint())));
    }

    @GetMapping
    @Operation(summary = "List accounts", description = "All accounts, optionally of one ledger kind.")
    public ResponseEntity<List<ApiResponses.AccountResponse>> listAccounts(
            @Parameter(description = "FINANCIAL or INVENTORY")
            @RequestParam(required = false) LedgerKind kind) {
        return ResponseEntity.ok(accountService.findAll(kind).stream()
                .map(ApiResponses.AccountResponse::new)
                .collect(Collectors.toList()));
    }

    @GetMapping("/{accountId}")
    @Operation(summary = "Get account")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "200", description = "Account found"),
        @ApiResponse(responseCode = "404", description = "Account not found")
    })
    public ResponseEntity<ApiResponses.AccountResponse> getAccount(@PathVariable Long accountId) {
        return ResponseEntity.ok(new ApiResponses.AccountResponse(accountService.find(accountId)));
    }

    @PutMapping("/{accountId}/thresholds")
    @Operation(summary = "Update stock thresholds",
               description = "Changes minimum, maximum and reorder point. Configuration only; no ledger entry.")
    public ResponseEntity<ApiResponses.AccountResponse> updateThresholds(
            @PathVariable Long accountId,
            @Valid @RequestBody StockThresholdsRequest request) {
        return ResponseEntity.ok(new ApiResponses.AccountResponse(
                accountService.updateStockThresholds(accountId, request.getMinimumStockLevel(),
                        request.getMaximumStockLevel(), request.getReorderPoint())));
    }

    @PutMapping("/{accountId}/payment-terms")
    @Operation(summary = "Update payment terms",
               description = "Changes supplier credit terms for purchases recorded from now on.")
    public ResponseEntity<ApiResponses.AccountResponse> updatePaymentTerms(
            @PathVariable Long accountId,
            @Valid @RequestBody PaymentTermsRequest request) {
        return ResponseEntity.ok(new ApiResponses.AccountResponse(
                accountService.updatePaymentTerms(accountId, request.getPaymentTermsDays())));
    }

    @PostMapping("/{accountId}/resume")
    @Operation(summary = "Resume halted account",
               description = "Replays the entry chain and, if intact, reseeds the cached balance and clears the halt.")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "200", description = "Account resumed"),
        @ApiResponse(responseCode = "404", description = "Account not found"),
        @ApiResponse(responseCode = "500", description = "Entry chain broken; account stays halted")
    })
    public ResponseEntity<ApiResponses.AccountResponse> resume(
            @PathVariable Long accountId,
            @Valid @RequestBody ResumeAccountRequest request) {
        return ResponseEntity.ok(new ApiResponses.AccountResponse(
                accountService.resume(accountId, request.getOperator())));
    }

    @PostMapping("/{accountId}/reconcile")
    @Operation(summary = "Reconcile account",
               description = "Compares full recompute with the incremental state. Halts the account on divergence.")
    public ResponseEntity<ApiResponses.ReconciliationResponse> reconcile(@PathVariable Long accountId) {
        return ResponseEntity.ok(new ApiResponses.ReconciliationResponse(
                reconciliationService.reconcile(accountId)));
    }
}
