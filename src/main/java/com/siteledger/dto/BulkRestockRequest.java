package com.siteledger.dto;

import com.siteledger.domain.EntryMetadata;
import com.siteledger.service.BatchLine;
import com.siteledger.service.TransactionRecorder;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * DTO for restocking several materials from one delivery. Date, reference,
 * description and created-by are shared by every line.
 */
public class BulkRestockRequest {

    @NotEmpty(message = "At least one restock line is required")
    @Size(max = TransactionRecorder.MAX_BATCH_LINES, message = "Too many restock lines")
    @Valid
    private List<Line> restocks;

    /**
     * Business date of the delivery. Defaults to now when omitted.
     */
    private Instant occurredAt;

    @Size(max = EntryMetadata.MAX_REFERENCE_LENGTH, message = "Reference is too long")
    private String reference;

    @Size(max = EntryMetadata.MAX_DESCRIPTION_LENGTH, message = "Description is too long")
    private String description;

    @Size(max = EntryMetadata.MAX_CREATED_BY_LENGTH, message = "Created-by is too long")
    private String createdBy;

    public BulkRestockRequest() {
    }

    public BulkRestockRequest(List<Line> restocks, Instant occurredAt) {
        this.restocks = restocks;
        this.occurredAt = occurredAt;
    }

    public List<BatchLine> toLines() {
        return restocks.stream()
                .map(line -> new BatchLine(line.getAccountId(), line.getQuantity()))
                .collect(Collectors.toList());
    }

    public EntryMetadata toMetadata() {
        return EntryMetadata.builder()
                .reference(reference)
                .description(description)
                .createdBy(createdBy)
                .build();
    }

    // Getters and Setters
    public List<Line> getRestocks() {
        return restocks;
    }

    public void setRestocks(List<Line> restocks) {
        this.restocks = restocks;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    public void setOccurredAt(Instant occurredAt) {
        this.occurredAt = occurredAt;
    }

    public String getReference() {
        return reference;
    }

    public void setReference(String reference) {
        this.reference = reference;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
    }

    public static class Line {

        @NotNull(message = "Account id is required for each restock")
        private Long accountId;

        @NotNull(message = "Quantity is required for each restock")
        private BigDecimal quantity;

        public Line() {
        }

        public Line(Long accountId, BigDecimal quantity) {
            this.accountId = accountId;
            this.quantity = quantity;
        }

        public Long getAccountId() {
            return accountId;
        }

        public void setAccountId(Long accountId) {
            this.accountId = accountId;
        }

        public BigDecimal getQuantity() {
            return quantity;
        }

        public void setQuantity(BigDecimal quantity) {
            this.quantity = quantity;
        }
    }
}
