package com.siteledger.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

/**
 * DTO for stock thresholds of a material. Maximum and reorder point are optional.
 */
public class StockThresholdsRequest {

    @NotNull(message = "Minimum stock level is required")
    @DecimalMin(value = "0", message = "Minimum stock level cannot be negative")
    private BigDecimal minimumStockLevel;

    @DecimalMin(value = "0", message = "Maximum stock level cannot be negative")
    private BigDecimal maximumStockLevel;

    @DecimalMin(value = "0", message = "Reorder point cannot be negative")
    private BigDecimal reorderPoint;

    public StockThresholdsRequest() {
    }

    public StockThresholdsRequest(BigDecimal minimumStockLevel, BigDecimal maximumStockLevel,
                                  BigDecimal reorderPoint) {
        this.minimumStockLevel = minimumStockLevel;
        this.maximumStockLevel = maximumStockLevel;
        this.reorderPoint = reorderPoint;
    }

    public BigDecimal getMinimumStockLevel() {
        return minimumStockLevel;
    }

    public void setMinimumStockLevel(BigDecimal minimumStockLevel) {
        this.minimumStockLevel = minimumStockLevel;
    }

    public BigDecimal getMaximumStockLevel() {
        return maximumStockLevel;
    }

    public void setMaximumStockLevel(BigDecimal maximumStockLevel) {
        this.maximumStockLevel = maximumStockLevel;
    }

    public BigDecimal getReorderPoint() {
        return reorderPoint;
    }

    public void setReorderPoint(BigDecimal reorderPoint) {
        this.reorderPoint = reorderPoint;
    }
}
