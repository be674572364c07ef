package com.siteledger.exception;

import com.siteledger.domain.TransactionType;

import java.math.BigDecimal;

/**
 * Amount or quantity does not match the sign convention of its transaction type.
 */
public class InvalidAmountException extends LedgerValidationException {

    private final TransactionType type;
    private final BigDecimal amount;

    public InvalidAmountException(TransactionType type, BigDecimal amount, String requirement) {
        super(String.format("Invalid amount for %s: %s (%s)", type, amount, requirement));
        this.type = type;
        this.amount = amount;
    }

    public TransactionType getType() {
        return type;
    }

    public BigDecimal getAmount() {
        return amount;
    }
}
