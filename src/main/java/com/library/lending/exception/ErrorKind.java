package com.library.lending.exception;

/**
 * Discriminator carried by every {@link LibraryException} and echoed in
 * {@code ErrorResponse.kind} so that callers can branch without parsing messages.
 */
public enum ErrorKind {
    VALIDATION_ERROR,
    DUPLICATE_KEY,
    NOT_FOUND,
    MEMBER_INACTIVE,
    NO_COPIES_AVAILABLE,
    ALREADY_RETURNED,
    BUSY,
    INTERNAL_INCONSISTENCY
}
