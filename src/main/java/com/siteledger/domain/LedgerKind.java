package com.siteledger.domain;

/**
 * The two ledgers that share the append-only protocol.
 *
 * FINANCIAL - a supplier account; balance is the amount owed to the supplier.
 * INVENTORY - one material at one location; balance is the quantity on hand.
 */
public enum LedgerKind {
    FINANCIAL,
    INVENTORY
}
