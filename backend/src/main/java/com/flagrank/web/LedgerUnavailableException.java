package com.flagrank.web;

/**
 * The ledger store could not complete a write or read. Nothing was committed for the request and the
 * caller may retry.
 */
public class LedgerUnavailableException extends RuntimeException {

    public LedgerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
