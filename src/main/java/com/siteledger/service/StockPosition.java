package com.siteledger.service;

import com.siteledger.domain.StockStatus;
import com.siteledger.domain.StockThresholds;

import java.math.BigDecimal;

public final class StockPosition {

    private final StockStatus status;
    private final BigDecimal quantity;
    private final boolean reorderRequired;
    private final StockThresholds thresholds;

    StockPosition(StockStatus status, BigDecimal quantity, boolean reorderRequired, StockThresholds thresholds) {
        this.status = status;
        this.quantity = quantity;
        this.reorderRequired = reorderRequired;
        this.thresholds = thresholds;
    }

    public StockStatus getStatus() {
        return status;
    }

    public BigDecimal getQuantity() {
        return quantity;
    }

    public boolean isReorderRequired() {
        return reorderRequired;
    }

    public StockThresholds getThresholds() {
        return thresholds;
    }
}
