package com.siteledger.service;

import com.siteledger.domain.TransactionType;
import com.siteledger.exception.LedgerValidationException;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Optional restrictions on a history page. Every part may be null.
 *
 * from and to are business dates (inclusive) compared against the entry's
 * occurredAt in the ledger zone. search matches reference or description,
 * case-insensitively.
 */
public final class HistoryFilter {

    public static final int MAX_SEARCH_LENGTH = 100;

    private static final HistoryFilter NONE = new HistoryFilter(null, null, null, null);

    private final TransactionType type;
    private final LocalDate from;
    private final LocalDate to;
    private final String search;

    private HistoryFilter(TransactionType type, LocalDate from, LocalDate to, String search) {
        this.type = type;
        this.from = from;
        this.to = to;
        this.search = search;
    }

    public static HistoryFilter none() {
        return NONE;
    }

    public static HistoryFilter ofType(TransactionType type) {
        return new HistoryFilter(type, null, null, null);
    }

    /**
     * @throws LedgerValidationException if from is after to or the search text is too long
     */
    public static HistoryFilter of(TransactionType type, LocalDate from, LocalDate to, String search) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new LedgerValidationException(String.format(
                    "Date range starts %s, after its end %s", from, to));
        }
        String text = search != null && !search.isBlank() ? search.trim() : null;
        if (text != null && text.length() > MAX_SEARCH_LENGTH) {
            throw new LedgerValidationException("Search text exceeds " + MAX_SEARCH_LENGTH + " characters");
        }
        return new HistoryFilter(type, from, to, text);
    }

    public TransactionType getType() {
        return type;
    }

    public LocalDate getFrom() {
        return from;
    }

    public LocalDate getTo() {
        return to;
    }

    public String getSearch() {
        return search;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HistoryFilter that = (HistoryFilter) o;
        return type == that.type
                && Objects.equals(from, that.from)
                && Objects.equals(to, that.to)
                && Objects.equals(search, that.search);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, from, to, search);
    }
}
