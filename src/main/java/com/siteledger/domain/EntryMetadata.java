package com.siteledger.domain;

import java.time.LocalDate;

/**
 * Provenance and options that travel with a recorded transaction.
 * Nothing here affects the running balance except {@code allowBackorder},
 * which permits an inventory decrease below zero.
 */
public final class EntryMetadata {

    public static final int MAX_REFERENCE_LENGTH = 100;
    public static final int MAX_DESCRIPTION_LENGTH = 500;
    public static final int MAX_CREATED_BY_LENGTH = 100;

    private static final EntryMetadata EMPTY = builder().build();

    private final String reference;
    private final String description;
    private final String createdBy;
    private final LocalDate dueDate;
    private final boolean allowBackorder;

    private EntryMetadata(Builder builder) {
        this.reference = builder.reference;
        this.description = builder.description;
        this.createdBy = builder.createdBy;
        this.dueDate = builder.dueDate;
        this.allowBackorder = builder.allowBackorder;
    }

    public static EntryMetadata empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getReference() {
        return reference;
    }

    public String getDescription() {
        return description;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public LocalDate getDueDate() {
        return dueDate;
    }

    public boolean isAllowBackorder() {
        return allowBackorder;
    }

    @Override
    public String toString() {
        return "EntryMetadata{" +
                "reference='" + reference + '\'' +
                ", createdBy='" + createdBy + '\'' +
                ", dueDate=" + dueDate +
                ", allowBackorder=" + allowBackorder +
                '}';
    }

    public static final class Builder {
        private String reference;
        private String description;
        private String createdBy;
        private LocalDate dueDate;
        private boolean allowBackorder;

        private Builder() {
        }

        public Builder reference(String reference) {
            this.reference = reference;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder dueDate(LocalDate dueDate) {
            this.dueDate = dueDate;
            return this;
        }

        public Builder allowBackorder(boolean allowBackorder) {
            this.allowBackorder = allowBackorder;
            return this;
        }

        public EntryMetadata build() {
            return new EntryMetadata(this);
        }
    }
}
