package com.siteledger.domain;

import org.springframework.data.domain.Sort;

/**
 * Orderings available when reading an account's entries.
 *
 * SEQUENCE follows entry numbers, which is the order the balance chain is built in.
 * CHRONOLOGICAL follows the business date and breaks ties by entry number; after a
 * backdated entry the two orders differ.
 */
public enum EntryOrder {
    CHRONOLOGICAL(Sort.by(Sort.Order.asc("occurredAt"), Sort.Order.asc("entryNumber"))),
    SEQUENCE(Sort.by(Sort.Order.asc("entryNumber")));

    private final Sort sort;

    EntryOrder(Sort sort) {
        this.sort = sort;
    }

    public Sort getSort() {
        return sort;
    }
}
