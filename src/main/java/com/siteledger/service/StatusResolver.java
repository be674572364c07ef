package com.siteledger.service;

import com.siteledger.domain.LedgerEntry;
import com.siteledger.domain.PaymentStatus;
import com.siteledger.domain.StockStatus;
import com.siteledger.domain.StockThresholds;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives payment and stock status from balances, thresholds and a date.
 * Pure: nothing here reads the clock or the database.
 *
 * Payment rules:
 * - NO_ACTIVITY while no entry has a non-zero delta
 * - PAID when balance <= 0
 * - PARTIAL when a credit came after the last debit, PENDING otherwise
 * - OVERDUE overlays PENDING/PARTIAL when a debit still has an unpaid remainder
 *   after FIFO allocation of credits and its due date is before {@code today}
 * - zero-delta entries never move the status
 *
 * Stock rules:
 * - NO_ACTIVITY without entries
 * - LOW when quantity <= minimum (wins over HIGH when thresholds overlap); a
 *   minimum of zero makes an empty or backordered material LOW
 * - HIGH when a maximum is set and quantity >= maximum
 * - reorder required when a reorder point is set and quantity <= reorder point,
 *   once the material has any activity
 */
@Component
public class StatusResolver {

    /**
     * Walk the entries in entry-number order and resolve the account status
     * plus the status of every entry.
     */
    public FinancialPosition resolveFinancial(Iterable<LedgerEntry> entriesInSequence, LocalDate today) {
        Deque<OpenDebit> open = new ArrayDeque<>();
        List<Slot> slots = new ArrayList<>();
        BigDecimal creditPool = BigDecimal.ZERO;
        BigDecimal balance = BigDecimal.ZERO;
        long lastDebit = 0;
        long lastCredit = 0;
        long position = 0;

        for (LedgerEntry entry : entriesInSequence) {
            position++;
            BigDecimal delta = entry.getDelta();
            balance = balance.add(delta);
            int signum = delta.signum();

            if (signum > 0) {
                lastDebit = position;
                OpenDebit debit = new OpenDebit(entry, delta);
                BigDecimal covered = delta.min(creditPool);
                debit.remaining = debit.remaining.subtract(covered);
                creditPool = creditPool.subtract(covered);
                if (debit.remaining.signum() > 0) {
                    open.addLast(debit);
                }
                slots.add(Slot.debit(debit));
            } else if (signum < 0) {
                lastCredit = position;
                BigDecimal toAllocate = delta.negate();
                while (toAllocate.signum() > 0 && !open.isEmpty()) {
                    OpenDebit head = open.peekFirst();
                    BigDecimal applied = head.remaining.min(toAllocate);
                    head.remaining = head.remaining.subtract(applied);
                    toAllocate = toAllocate.subtract(applied);
                    if (head.remaining.signum() == 0) {
                        open.pollFirst();
                    }
                }
                creditPool = creditPool.add(toAllocate);
                PaymentStatus entryStatus = entry.getBalanceAfter().signum() <= 0
                        ? PaymentStatus.PAID : PaymentStatus.PARTIAL;
                slots.add(Slot.fixed(entry.getEntryNumber(), entryStatus));
            } else {
                slots.add(Slot.inherit(entry.getEntryNumber()));
            }
        }

        BigDecimal overdueAmount = BigDecimal.ZERO;
        LocalDate oldestOverdue = null;
        List<OverdueEntry> overdueEntries = new ArrayList<>();
        for (OpenDebit debit : open) {
            if (debit.isOverdue(today)) {
                overdueAmount = overdueAmount.add(debit.remaining);
                if (oldestOverdue == null || debit.dueDate.isBefore(oldestOverdue)) {
                    oldestOverdue = debit.dueDate;
                }
                overdueEntries.add(new OverdueEntry(debit.entry, debit.remaining, today));
            }
        }
        overdueEntries.sort(Comparator.comparing(OverdueEntry::getDueDate)
                .thenComparingLong(OverdueEntry::getEntryNumber));

        PaymentStatus status;
        if (lastDebit == 0 && lastCredit == 0) {
            status = PaymentStatus.NO_ACTIVITY;
        } else if (balance.signum() <= 0) {
            status = PaymentStatus.PAID;
        } else if (overdueAmount.signum() > 0) {
            status = PaymentStatus.OVERDUE;
        } else if (lastCredit > lastDebit) {
            status = PaymentStatus.PARTIAL;
        } else {
            status = PaymentStatus.PENDING;
        }

        Map<Long, PaymentStatus> entryStatuses = new LinkedHashMap<>();
        PaymentStatus previous = PaymentStatus.NO_ACTIVITY;
        for (Slot slot : slots) {
            PaymentStatus resolved = slot.resolve(previous, today);
            entryStatuses.put(slot.entryNumber, resolved);
            previous = resolved;
        }

        return new FinancialPosition(status, balance, overdueAmount, oldestOverdue, overdueEntries, entryStatuses);
    }

    /**
     * @param entryCount number of entries in the account; zero means no activity,
     *                   which never asks for a reorder
     */
    public StockPosition resolveStock(BigDecimal quantity, long entryCount, StockThresholds thresholds) {
        if (entryCount == 0) {
            return new StockPosition(StockStatus.NO_ACTIVITY, quantity, false, thresholds);
        }
        return new StockPosition(stockStatus(quantity, thresholds), quantity,
                isReorderRequired(quantity, thresholds), thresholds);
    }

    /**
     * Stock status of a quantity. Used for the account and for each history row.
     */
    public StockStatus stockStatus(BigDecimal quantity, StockThresholds thresholds) {
        if (quantity.compareTo(thresholds.getMinimum()) <= 0) {
            return StockStatus.LOW;
        }
        if (thresholds.getMaximum() != null && quantity.compareTo(thresholds.getMaximum()) >= 0) {
            return StockStatus.HIGH;
        }
        return StockStatus.NORMAL;
    }

    public boolean isReorderRequired(BigDecimal quantity, StockThresholds thresholds) {
        return thresholds.getReorderPoint() != null && quantity.compareTo(thresholds.getReorderPoint()) <= 0;
    }

    private static final class OpenDebit {
        private final LedgerEntry entry;
        private final long entryNumber;
        private final LocalDate dueDate;
        private final BigDecimal amount;
        private BigDecimal remaining;

        private OpenDebit(LedgerEntry entry, BigDecimal amount) {
            this.entry = entry;
            this.entryNumber = entry.getEntryNumber();
            this.dueDate = entry.getDueDate();
            this.amount = amount;
            this.remaining = amount;
        }

        private boolean isOverdue(LocalDate today) {
            return remaining.signum() > 0 && dueDate != null && dueDate.isBefore(today);
        }
    }

    /**
     * Status placeholder for one entry. Debit statuses depend on allocations made by
     * later credits, so they are read only after the whole history has been walked.
     */
    private static final class Slot {
        private final long entryNumber;
        private final OpenDebit debit;
        private final PaymentStatus fixed;

        private Slot(long entryNumber, OpenDebit debit, PaymentStatus fixed) {
            this.entryNumber = entryNumber;
            this.debit = debit;
            this.fixed = fixed;
        }

        static Slot debit(OpenDebit debit) {
            return new Slot(debit.entryNumber, debit, null);
        }

        static Slot fixed(long entryNumber, PaymentStatus status) {
            return new Slot(entryNumber, null, status);
        }

        static Slot inherit(long entryNumber) {
            return new Slot(entryNumber, null, null);
        }

        PaymentStatus resolve(PaymentStatus previous, LocalDate today) {
            if (debit != null) {
                if (debit.remaining.signum() == 0) {
                    return PaymentStatus.PAID;
                }
                if (debit.isOverdue(today)) {
                    return PaymentStatus.OVERDUE;
                }
                return debit.remaining.compareTo(debit.amount) < 0 ? PaymentStatus.PARTIAL : PaymentStatus.PENDING;
            }
            return fixed != null ? fixed : previous;
        }
    }
}
