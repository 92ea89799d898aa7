package com.library.lending.dto.response;

import com.library.lending.entity.BorrowingStatus;

import java.time.LocalDate;

/** {@code status} is the effective status: open loans past their due date read as OVERDUE. */
public record BorrowingResponse(
    Long id,
    Long memberId,
    String memberName,
    Long bookId,
    String bookTitle,
    String isbn,
    LocalDate borrowDate,
    LocalDate dueDate,
    LocalDate returnDate,
    BorrowingStatus status
) {}
