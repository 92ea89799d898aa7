package com.library.lending.exception;

public abstract class LibraryException extends RuntimeException {

    private final ErrorKind kind;

    protected LibraryException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected LibraryException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
