package com.flagrank.service;

/**
 * Raised inside a ledger transaction when a uniqueness constraint shows that another request already
 * recorded the same entry. The transaction rolls back and the caller reports the ordinary outcome.
 */
public class LedgerConflictException extends RuntimeException {

    public LedgerConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
