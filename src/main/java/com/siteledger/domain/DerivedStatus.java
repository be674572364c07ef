package com.siteledger.domain;

/**
 * A status computed from an account's entries and the current date.
 * Never persisted as the source of truth.
 */
public interface DerivedStatus {

    String name();

    /**
     * True for the "no activity" status, which is kept distinct from
     * PAID / NORMAL so that untouched accounts do not look settled.
     */
    boolean isNoActivity();
}
