package com.library.lending.exception;

public class AlreadyReturnedException extends LibraryException {

    public AlreadyReturnedException(Long borrowingId) {
        super(ErrorKind.ALREADY_RETURNED, "Borrowing " + borrowingId + " has already been returned");
    }
}
