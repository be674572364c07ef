package com.siteledger.domain;

/**
 * Payment status of a supplier account or a single financial entry.
 *
 * OVERDUE is an overlay evaluated against "today" at query time; it is never
 * written anywhere because it changes without any write happening.
 */
public enum PaymentStatus implements DerivedStatus {
    NO_ACTIVITY,
    PENDING,
    PARTIAL,
    PAID,
    OVERDUE;

    @Override
    public boolean isNoActivity() {
        return this == NO_ACTIVITY;
    }
}
