package com.siteledger.service;

import com.siteledger.domain.EntryOrder;

import java.util.List;

/**
 * One page of an account's history. Page numbers start at 1.
 */
public final class HistoryPage {

    private final Long accountId;
    private final List<EntryView> entries;
    private final int page;
    private final int size;
    private final long totalItems;
    private final int totalPages;
    private final EntryOrder order;

    public HistoryPage(Long accountId, List<EntryView> entries, int page, int size, long totalItems,
                       int totalPages, EntryOrder order) {
        this.accountId = accountId;
        this.entries = List.copyOf(entries);
        this.page = page;
        this.size = size;
        this.totalItems = totalItems;
        this.totalPages = totalPages;
        this.order = order;
    }

    public Long getAccountId() {
        return accountId;
    }

    public List<EntryView> getEntries() {
        return entries;
    }

    public int getPage() {
        return page;
    }

    public int getSize() {
        return size;
    }

    public long getTotalItems() {
        return totalItems;
    }

    public int getTotalPages() {
        return totalPages;
    }

    public EntryOrder getOrder() {
        return order;
    }
}
