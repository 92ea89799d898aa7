package com.library.lending.exception;

public class DuplicateCategoryException extends LibraryException {

    public DuplicateCategoryException(String name) {
        super(ErrorKind.DUPLICATE_KEY, "Category already exists: " + name);
    }
}
