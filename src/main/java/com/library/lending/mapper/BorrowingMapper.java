package com.library.lending.mapper;

import com.library.lending.dto.response.BorrowingResponse;
import com.library.lending.entity.Book;
import com.library.lending.entity.Borrowing;
import com.library.lending.entity.Member;
import com.library.lending.exception.InventoryInconsistencyException;

import java.time.LocalDate;

public final class BorrowingMapper {

    private BorrowingMapper() {}

    /**
     * @param today the date against which an open loan is judged overdue
     * @throws InventoryInconsistencyException if the member or book reference is missing
     */
    public static BorrowingResponse toResponse(Borrowing borrowing, LocalDate today) {
        Member member = borrowing.getMember();
        Book book = borrowing.getBook();
        if (member == null || book == null) {
            throw new InventoryInconsistencyException(
                "Borrowing " + borrowing.getId() + " does not reference both a member and a book");
        }

        return new BorrowingResponse(
            borrowing.getId(),
            member.getId(),
            member.getFullName(),
            book.getId(),
            book.getTitle(),
            book.getIsbn(),
            borrowing.getBorrowDate(),
            borrowing.getDueDate(),
            borrowing.getReturnDate(),
            borrowing.effectiveStatus(today)
        );
    }
}
