package com.siteledger.dto;

import com.siteledger.domain.EntryMetadata;
import com.siteledger.domain.TransactionType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * DTO for recording a purchase, payment, adjustment or stock movement.
 *
 * amount is a magnitude; the sign comes from the transaction type. Only the
 * inventory ADJUSTMENT type accepts a negative amount.
 */
public class RecordTransactionRequest {

    @NotNull(message = "Transaction type is required")
    private TransactionType type;

    @NotNull(message = "Amount is required")
    private BigDecimal amount;

    /**
     * Business date of the transaction. Defaults to now when omitted.
     */
    private Instant occurredAt;

    @Size(max = EntryMetadata.MAX_REFERENCE_LENGTH, message = "Reference is too long")
    private String reference;

    @Size(max = EntryMetadata.MAX_DESCRIPTION_LENGTH, message = "Description is too long")
    private String description;

    @Size(max = EntryMetadata.MAX_CREATED_BY_LENGTH, message = "Created-by is too long")
    private String createdBy;

    private LocalDate dueDate;

    private boolean allowBackorder;

    // Constructors
    public RecordTransactionRequest() {
    }

    public RecordTransactionRequest(TransactionType type, BigDecimal amount, Instant occurredAt) {
        this.type = type;
        this.amount = amount;
        this.occurredAt = occurredAt;
    }

    public EntryMetadata toMetadata() {
        return EntryMetadata.builder()
                .reference(reference)
                .description(description)
                .createdBy(createdBy)
                .dueDate(dueDate)
                .allowBackorder(allowBackorder)
                .build();
    }

    // Getters and Setters
    public TransactionType getType() {
        return type;
    }

    public void setType(TransactionType type) {
        this.type = type;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public void setAmount(BigDecimal amount) {
        this.amount = amount;
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

    public LocalDate getDueDate() {
        return dueDate;
    }

    public void setDueDate(LocalDate dueDate) {
        this.dueDate = dueDate;
    }

    public boolean isAllowBackorder() {
        return allowBackorder;
    }

    public void setAllowBackorder(boolean allowBackorder) {
        this.allowBackorder = allowBackorder;
    }
}
