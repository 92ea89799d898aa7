package com.library.lending.exception;

public class ResourceNotFoundException extends LibraryException {

    public ResourceNotFoundException(String entityName, Long id) {
        super(ErrorKind.NOT_FOUND, entityName + " not found with id " + id);
    }
}
