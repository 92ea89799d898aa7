package com.library.lending.exception;

/**
 * The lending transaction could not get its locks, or finish, within the configured
 * timeout. Nothing was applied; the caller may retry.
 */
public class LendingBusyException extends LibraryException {

    public LendingBusyException(String message, Throwable cause) {
        super(ErrorKind.BUSY, message, cause);
    }
}
