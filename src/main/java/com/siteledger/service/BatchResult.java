package com.siteledger.service;

import com.siteledger.domain.LedgerEntry;

import java.util.List;

/**
 * Outcome of a batch recording: the entries that were appended and the lines that
 * were refused, each with the error it would have produced on its own.
 */
public final class BatchResult {

    private final List<LedgerEntry> recorded;
    private final List<Failure> failures;

    BatchResult(List<LedgerEntry> recorded, List<Failure> failures) {
        this.recorded = List.copyOf(recorded);
        this.failures = List.copyOf(failures);
    }

    public List<LedgerEntry> getRecorded() {
        return recorded;
    }

    public List<Failure> getFailures() {
        return failures;
    }

    public boolean hasRecorded() {
        return !recorded.isEmpty();
    }

    public static final class Failure {

        private final int line;
        private final Long accountId;
        private final String error;
        private final String message;

        Failure(int line, Long accountId, String error, String message) {
            this.line = line;
            this.accountId = accountId;
            this.error = error;
            this.message = message;
        }

        /**
         * Zero-based position of the line in the request.
         */
        public int getLine() {
            return line;
        }

        public Long getAccountId() {
            return accountId;
        }

        /**
         * Same code the single-entry endpoint returns for this failure.
         */
        public String getError() {
            return error;
        }

        public String getMessage() {
            return message;
        }
    }
}
