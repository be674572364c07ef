package com.siteledger.domain;

import com.siteledger.exception.LedgerValidationException;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Stock thresholds of an inventory account.
 * Minimum is required; maximum and reorder point are optional.
 */
public final class StockThresholds {

    private final BigDecimal minimum;
    private final BigDecimal maximum;
    private final BigDecimal reorderPoint;

    private StockThresholds(BigDecimal minimum, BigDecimal maximum, BigDecimal reorderPoint) {
        this.minimum = minimum;
        this.maximum = maximum;
        this.reorderPoint = reorderPoint;
    }

    /**
     * @throws LedgerValidationException if a threshold is negative or maximum is below minimum
     */
    public static StockThresholds of(BigDecimal minimum, BigDecimal maximum, BigDecimal reorderPoint) {
        if (minimum == null) {
            throw new LedgerValidationException("Minimum stock level is required");
        }
        requireNonNegative("Minimum stock level", minimum);
        requireNonNegative("Maximum stock level", maximum);
        requireNonNegative("Reorder point", reorderPoint);
        if (maximum != null && maximum.compareTo(minimum) < 0) {
            throw new LedgerValidationException(String.format(
                    "Maximum stock level %s is below minimum %s", maximum, minimum));
        }
        return new StockThresholds(minimum, maximum, reorderPoint);
    }

    private static void requireNonNegative(String label, BigDecimal value) {
        if (value != null && value.signum() < 0) {
            throw new LedgerValidationException(label + " cannot be negative: " + value);
        }
    }

    public BigDecimal getMinimum() {
        return minimum;
    }

    public BigDecimal getMaximum() {
        return maximum;
    }

    public BigDecimal getReorderPoint() {
        return reorderPoint;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StockThresholds that = (StockThresholds) o;
        return compare(minimum, that.minimum)
                && compare(maximum, that.maximum)
                && compare(reorderPoint, that.reorderPoint);
    }

    private static boolean compare(BigDecimal a, BigDecimal b) {
        return a == null ? b == null : b != null && a.compareTo(b) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(strip(minimum), strip(maximum), strip(reorderPoint));
    }

    private static BigDecimal strip(BigDecimal value) {
        return value == null ? null : value.stripTrailingZeros();
    }

    @Override
    public String toString() {
        return "StockThresholds{min=" + minimum + ", max=" + maximum + ", reorder=" + reorderPoint + '}';
    }
}
