package com.siteledger.service;

import com.siteledger.domain.EntryOrder;
import com.siteledger.domain.LedgerEntry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Running-balance arithmetic.
 *
 * {@link #recompute(Long)} folds the whole history and is the authority during
 * reconciliation. {@link #incremental(BigDecimal, BigDecimal)} is the O(1) step
 * used on the write path.
 */
@Component
public class BalanceCalculator {

    private final EntryStore entryStore;

    public BalanceCalculator(EntryStore entryStore) {
        this.entryStore = entryStore;
    }

    /**
     * Sum of every delta of the account, in entry-number order. Zero for an empty ledger.
     */
    public BigDecimal recompute(Long accountId) {
        BigDecimal balance = BigDecimal.ZERO;
        for (LedgerEntry entry : entryStore.listByAccount(accountId, EntryOrder.SEQUENCE)) {
            balance = balance.add(entry.getDelta());
        }
        return balance;
    }

    public BigDecimal incremental(BigDecimal lastBalance, BigDecimal delta) {
        return (lastBalance != null ? lastBalance : BigDecimal.ZERO).add(delta);
    }

    public BalanceTotals totals(Long accountId) {
        return totals(entryStore.listByAccount(accountId, EntryOrder.SEQUENCE));
    }

    public BalanceTotals totals(Iterable<LedgerEntry> entries) {
        long count = 0;
        BigDecimal debits = BigDecimal.ZERO;
        BigDecimal credits = BigDecimal.ZERO;
        BigDecimal balance = BigDecimal.ZERO;
        Instant lastOccurredAt = null;
        long lastEntryNumber = 0;

        for (LedgerEntry entry : entries) {
            count++;
            BigDecimal delta = entry.getDelta();
            if (delta.signum() > 0) {
                debits = debits.add(delta);
            } else if (delta.signum() < 0) {
                credits = credits.add(delta.negate());
            }
            balance = balance.add(delta);
            if (lastOccurredAt == null || entry.getOccurredAt().isAfter(lastOccurredAt)) {
                lastOccurredAt = entry.getOccurredAt();
            }
            lastEntryNumber = Math.max(lastEntryNumber, entry.getEntryNumber());
        }
        if (count == 0) {
            return BalanceTotals.EMPTY;
        }
        return new BalanceTotals(count, debits, credits, balance, lastOccurredAt, lastEntryNumber);
    }

    public ChainReplay replay(Long accountId) {
        return replay(entryStore.listByAccount(accountId, EntryOrder.SEQUENCE));
    }

    /**
     * Check the running-balance chain. Entries must be in entry-number order.
     * Stops at the first break.
     */
    public ChainReplay replay(Iterable<LedgerEntry> entriesInSequence) {
        BigDecimal previous = BigDecimal.ZERO;
        long expectedNumber = 1;
        long checked = 0;

        for (LedgerEntry entry : entriesInSequence) {
            checked++;
            if (entry.getEntryNumber() != expectedNumber) {
                return ChainReplay.broken(checked, entry.getEntryNumber(), String.format(
                        "expected entry %d but found %d", expectedNumber, entry.getEntryNumber()), previous);
            }
            BigDecimal expectedBalance = incremental(previous, entry.getDelta());
            if (expectedBalance.compareTo(entry.getBalanceAfter()) != 0) {
                return ChainReplay.broken(checked, entry.getEntryNumber(), String.format(
                        "entry %d balanceAfter %s but previous %s plus delta %s gives %s",
                        entry.getEntryNumber(), entry.getBalanceAfter().toPlainString(), previous.toPlainString(),
                        entry.getDelta().toPlainString(), expectedBalance.toPlainString()), previous);
            }
            previous = expectedBalance;
            expectedNumber++;
        }
        return ChainReplay.intact(checked, previous);
    }
}
