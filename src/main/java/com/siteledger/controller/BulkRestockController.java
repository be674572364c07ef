package com.siteledger.controller;

import com.siteledger.domain.TransactionType;
import com.siteledger.dto.ApiResponses;
import com.siteledger.dto.BulkRestockRequest;
import com.siteledger.service.BatchResult;
import com.siteledger.service.TransactionRecorder;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

/**
 * REST controller for deliveries that restock many materials at once.
 *
 * CONTRACT:
 * - POST /restocks/bulk → 201 Created if any line was recorded | 422 if none was | 400
 */
@RestController
@RequestMapping("/restocks")
@Tag(name = "Restocks", description = "Record one delivery against several materials")
public class BulkRestockController {

    private final TransactionRecorder transactionRecorder;
    private final Clock clock;

    public BulkRestockController(TransactionRecorder transactionRecorder, Clock clock) {
        this.transactionRecorder = transactionRecorder;
        this.clock = clock;
    }

    @PostMapping("/bulk")
    @Operation(
        summary = "Bulk restock",
        description = "Appends one RESTOCK entry per line. Lines are independent: a refused line is " +
                      "reported in 'failures' with the error code it would get on its own."
    )
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "201", description = "At least one line recorded"),
        @ApiResponse(responseCode = "400", description = "Malformed batch; nothing recorded"),
        @ApiResponse(responseCode = "422", description = "Every line was refused")
    })
    public ResponseEntity<ApiResponses.BatchResponse> restock(@Valid @RequestBody BulkRestockRequest request) {
        Instant occurredAt = request.getOccurredAt() != null ? request.getOccurredAt() : clock.instant();
        BatchResult result = transactionRecorder.recordBatch(TransactionType.RESTOCK, request.toLines(),
                occurredAt, request.toMetadata());
        HttpStatus status = result.hasRecorded() ? HttpStatus.CREATED : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(new ApiResponses.BatchResponse(result));
    }
}
