package com.library.lending.exception;

public class DuplicateEmailException extends LibraryException {

    public DuplicateEmailException(String email) {
        super(ErrorKind.DUPLICATE_KEY, "A member with email " + email + " already exists");
    }
}
