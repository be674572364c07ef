package com.siteledger.domain;

/**
 * Stock status of an inventory account, derived from quantity vs thresholds.
 */
public enum StockStatus implements DerivedStatus {
    NO_ACTIVITY,
    LOW,
    NORMAL,
    HIGH;

    @Override
    public boolean isNoActivity() {
        return this == NO_ACTIVITY;
    }
}
