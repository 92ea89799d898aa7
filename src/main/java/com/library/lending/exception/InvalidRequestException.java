package com.library.lending.exception;

/** Input that passed syntactic validation but breaks a domain rule, e.g. copy counts. */
public class InvalidRequestException extends LibraryException {

    public InvalidRequestException(String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
    }
}
