package com.library.lending.exception;

public class NoCopiesAvailableException extends LibraryException {

    public NoCopiesAvailableException(Long bookId) {
        super(ErrorKind.NO_COPIES_AVAILABLE, "No copies of book " + bookId + " are available");
    }
}
