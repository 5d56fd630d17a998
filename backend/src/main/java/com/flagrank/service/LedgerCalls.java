package com.flagrank.service;

import com.flagrank.web.LedgerUnavailableException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.function.Supplier;

/**
 * Maps store outages and lock timeouts to {@link LedgerUnavailableException}. Other data access
 * failures propagate unchanged.
 */
final class LedgerCalls {

    private LedgerCalls() {
    }

    static <T> T guarded(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (TransientDataAccessException
                 | DataAccessResourceFailureException
                 | CannotCreateTransactionException ex) {
            throw new LedgerUnavailableException(operation + " could not be completed; retry the request", ex);
        }
    }
}
