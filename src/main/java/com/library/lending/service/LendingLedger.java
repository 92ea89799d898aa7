package com.library.lending.service;

import com.library.lending.entity.Book;
import com.library.lending.entity.Borrowing;
import com.library.lending.entity.BorrowingStatus;
import com.library.lending.entity.Member;
import com.library.lending.exception.AlreadyReturnedException;
import com.library.lending.exception.InventoryInconsistencyException;
import com.library.lending.exception.MemberInactiveException;
import com.library.lending.exception.NoCopiesAvailableException;
import com.library.lending.exception.ResourceNotFoundException;
import com.library.lending.repository.BookRepository;
import com.library.lending.repository.BorrowingRepository;
import com.library.lending.repository.MemberRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;

/**
 * The two state transitions that move copies between the shelf and members.
 *
 * <p>Each method is one transaction that changes a book's {@code available_copies} and a
 * borrowing row together. Both counter changes are compare-and-set UPDATEs checked by
 * their affected-row count, so they cannot drive the counter below zero or above
 * {@code total_copies} however many callers race. Every failure is an unchecked exception
 * and rolls the whole transaction back; there is no path that keeps one write without
 * the other.
 *
 * <p>Each row-lock wait is bounded by the connection's lock timeout and the whole call by
 * the transaction timeout, both taken from
 * {@code library.lending.transaction-timeout-seconds}. A lock timeout, a cancelled
 * statement or an expired deadline is translated to {@code LendingBusyException} by
 * {@link LendingService}.
 */
@Component
@RequiredArgsConstructor
public class LendingLedger {

    private final MemberRepository memberRepository;
    private final BookRepository bookRepository;
    private final BorrowingRepository borrowingRepository;
    private final Clock clock;

    /**
     * Lends one copy of a book.
     *
     * <p>Checks in this order: member exists, book exists, a copy is available, member is
     * active. A book with no copies therefore reports {@link NoCopiesAvailableException}
     * whatever the member's status.
     */
    @Transactional(timeoutString = "${library.lending.transaction-timeout-seconds:5}")
    public Borrowing checkout(Long memberId, Long bookId, int loanPeriodDays) {
        Member member = memberRepository.findById(memberId)
            .orElseThrow(() -> new ResourceNotFoundException("Member", memberId));
        Book book = bookRepository.findById(bookId)
            .orElseThrow(() -> new ResourceNotFoundException("Book", bookId));

        if (book.getAvailableCopies() <= 0) {
            throw new NoCopiesAvailableException(bookId);
        }
        if (!member.isActive()) {
            throw new MemberInactiveException(memberId);
        }

        Instant now = Instant.now(clock);
        if (bookRepository.decrementAvailableCopies(bookId, now) == 0) {
            // lost the race for the last copy
            throw new NoCopiesAvailableException(bookId);
        }

        LocalDate today = LocalDate.now(clock);
        Borrowing borrowing = new Borrowing();
        borrowing.setMember(member);
        borrowing.setBook(book);
        borrowing.setBorrowDate(today);
        borrowing.setDueDate(today.plusDays(loanPeriodDays));
        borrowing.setStatus(BorrowingStatus.BORROWED);
        return borrowingRepository.save(borrowing);
    }

    /**
     * Closes an open loan and puts the copy back on the shelf. Overdue loans are open
     * loans and can be returned like any other.
     */
    @Transactional(timeoutString = "${library.lending.transaction-timeout-seconds:5}")
    public Borrowing returnBorrowing(Long borrowingId) {
        Borrowing borrowing = borrowingRepository.findByIdWithMemberAndBook(borrowingId)
            .orElseThrow(() -> new ResourceNotFoundException("Borrowing", borrowingId));
        if (borrowing.getStatus() == BorrowingStatus.RETURNED) {
            throw new AlreadyReturnedException(borrowingId);
        }
        Long bookId = borrowing.getBook().getId();

        Instant now = Instant.now(clock);
        int closed = borrowingRepository.transitionStatus(borrowingId,
            BorrowingStatus.BORROWED, BorrowingStatus.RETURNED, LocalDate.now(clock), now);
        if (closed == 0) {
            // a concurrent return got there first
            throw new AlreadyReturnedException(borrowingId);
        }

        if (bookRepository.incrementAvailableCopies(bookId, now) == 0) {
            throw new InventoryInconsistencyException("Book " + bookId
                + " already shows every copy available while borrowing " + borrowingId
                + " was still open; return rolled back");
        }

        return borrowingRepository.findByIdWithMemberAndBook(borrowingId)
            .orElseThrow(() -> new InventoryInconsistencyException(
                "Borrowing " + borrowingId + " vanished during its own return"));
    }
}
