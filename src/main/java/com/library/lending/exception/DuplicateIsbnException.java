package com.library.lending.exception;

public class DuplicateIsbnException extends LibraryException {

    public DuplicateIsbnException(String isbn) {
        super(ErrorKind.DUPLICATE_KEY, "ISBN already exists: " + isbn);
    }
}
