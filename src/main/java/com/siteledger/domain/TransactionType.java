package com.siteledger.domain;

import com.siteledger.exception.InvalidAmountException;

import java.math.BigDecimal;

/**
 * Closed set of ledger transaction types with their sign convention.
 *
 * Callers always hand the recorder a magnitude; the delta written to the ledger
 * is derived here and nowhere else.
 *
 * <pre>
 * Type               Ledger     Sign   Zero allowed
 * PURCHASE           FINANCIAL   +      no
 * PAYMENT            FINANCIAL   -      no
 * ADJUSTMENT_DEBIT   FINANCIAL   +      yes   (debit note, we owe more)
 * ADJUSTMENT_CREDIT  FINANCIAL   -      yes   (credit note, we owe less)
 * ISSUE              INVENTORY   -      no
 * RETURN             INVENTORY   +      no
 * RESTOCK            INVENTORY   +      no
 * CONSUMPTION        INVENTORY   -      no
 * ADJUSTMENT         INVENTORY   signed yes   (stock-take correction)
 * </pre>
 */
public enum TransactionType {
    PURCHASE(LedgerKind.FINANCIAL, Sign.INCREASE, false),
    PAYMENT(LedgerKind.FINANCIAL, Sign.DECREASE, false),
    ADJUSTMENT_DEBIT(LedgerKind.FINANCIAL, Sign.INCREASE, true),
    ADJUSTMENT_CREDIT(LedgerKind.FINANCIAL, Sign.DECREASE, true),
    ISSUE(LedgerKind.INVENTORY, Sign.DECREASE, false),
    RETURN(LedgerKind.INVENTORY, Sign.INCREASE, false),
    RESTOCK(LedgerKind.INVENTORY, Sign.INCREASE, false),
    CONSUMPTION(LedgerKind.INVENTORY, Sign.DECREASE, false),
    ADJUSTMENT(LedgerKind.INVENTORY, Sign.SIGNED, true);

    /**
     * How a caller-supplied amount maps onto the ledger delta.
     */
    public enum Sign {
        INCREASE,
        DECREASE,
        SIGNED
    }

    private final LedgerKind ledger;
    private final Sign sign;
    private final boolean zeroAllowed;

    TransactionType(LedgerKind ledger, Sign sign, boolean zeroAllowed) {
        this.ledger = ledger;
        this.sign = sign;
        this.zeroAllowed = zeroAllowed;
    }

    public LedgerKind getLedger() {
        return ledger;
    }

    public Sign getSign() {
        return sign;
    }

    public boolean isZeroAllowed() {
        return zeroAllowed;
    }

    /**
     * Debit-side financial entries create an amount owed and can carry a due date.
     */
    public boolean carriesDueDate() {
        return ledger == LedgerKind.FINANCIAL && sign == Sign.INCREASE;
    }

    /**
     * Check the amount against this type's convention.
     *
     * @throws InvalidAmountException if the amount is null, negative for a
     *         fixed-sign type, or zero where zero is not allowed
     */
    public void validateAmount(BigDecimal amount) {
        if (amount == null) {
            throw new InvalidAmountException(this, null, "amount is required");
        }
        int signum = amount.signum();
        if (signum == 0 && !zeroAllowed) {
            throw new InvalidAmountException(this, amount, "must be positive");
        }
        if (signum < 0 && sign != Sign.SIGNED) {
            throw new InvalidAmountException(this, amount,
                    "pass a magnitude; the sign comes from the transaction type");
        }
    }

    /**
     * Signed delta contributed to the running balance.
     */
    public BigDecimal toDelta(BigDecimal amount) {
        validateAmount(amount);
        return sign == Sign.DECREASE ? amount.negate() : amount;
    }
}
