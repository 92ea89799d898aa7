package com.library.lending.exception;

import org.springframework.core.NestedRuntimeException;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.TransactionTimedOutException;

/**
 * Recognises persistence failures that mean "gave up waiting": lock timeouts, statement
 * timeouts, and a transaction that ran past its deadline.
 *
 * <p>Hibernate reports an expired transaction deadline as
 * {@link org.hibernate.TransactionException}, which Spring wraps in
 * {@code JpaSystemException} (before commit) or {@code TransactionSystemException}
 * (at commit) rather than in a timeout type.
 */
public final class ContentionFailures {

    private ContentionFailures() {}

    public static boolean isContention(Throwable ex) {
        if (ex instanceof ConcurrencyFailureException
                || ex instanceof QueryTimeoutException
                || ex instanceof TransactionTimedOutException) {
            return true;
        }
        return ex instanceof NestedRuntimeException nested
            && nested.contains(org.hibernate.TransactionException.class);
    }
}
