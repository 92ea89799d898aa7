package com.library.lending.entity;

/**
 * Lifecycle states for a {@link Borrowing}.
 *
 * <ul>
 *   <li>{@link #BORROWED} - checked out and not yet returned. The only state that
 *       holds a copy of the book.</li>
 *   <li>{@link #RETURNED} - terminal; {@code return_date} is set.</li>
 *   <li>{@link #OVERDUE}  - read-side label for a {@code BORROWED} row whose due date has
 *       passed. Never written to the {@code borrowings} table.</li>
 * </ul>
 */
public enum BorrowingStatus {
    BORROWED,
    RETURNED,
    OVERDUE
}
