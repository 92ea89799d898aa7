package com.library.lending.exception;

/**
 * The stored state already contradicts the copy-count invariant, or a borrowing refers to
 * a row that does not exist. Signals a defect or an out-of-band write, not bad input.
 */
public class InventoryInconsistencyException extends LibraryException {

    public InventoryInconsistencyException(String message) {
        super(ErrorKind.INTERNAL_INCONSISTENCY, message);
    }
}
