package com.library.lending.service;

import com.library.lending.config.LendingProperties;
import com.library.lending.dto.request.CheckoutRequest;
import com.library.lending.dto.response.BorrowingResponse;
import com.library.lending.dto.response.InventoryResponse;
import com.library.lending.entity.Book;
import com.library.lending.entity.Borrowing;
import com.library.lending.entity.BorrowingStatus;
import com.library.lending.exception.ContentionFailures;
import com.library.lending.exception.InvalidRequestException;
import com.library.lending.exception.InventoryInconsistencyException;
import com.library.lending.exception.LendingBusyException;
import com.library.lending.exception.LibraryException;
import com.library.lending.exception.ResourceNotFoundException;
import com.library.lending.mapper.BorrowingMapper;
import com.library.lending.repository.BookRepository;
import com.library.lending.repository.BorrowingRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Entry point for lending operations. Resolves loan periods, runs the transitions in
 * {@link LendingLedger}, turns lock, statement and transaction timeouts into
 * {@link LendingBusyException} and maps results to views.
 */
@Service
@RequiredArgsConstructor
public class LendingService {

    private static final Logger log = LoggerFactory.getLogger(LendingService.class);

    private final LendingLedger ledger;
    private final LendingProperties properties;
    private final BorrowingRepository borrowingRepository;
    private final BookRepository bookRepository;
    private final Clock clock;

    public BorrowingResponse checkout(CheckoutRequest request) {
        int loanPeriodDays = resolveLoanPeriod(request.loanPeriodDays());
        Borrowing borrowing;
        try {
            borrowing = ledger.checkout(request.memberId(), request.bookId(), loanPeriodDays);
        } catch (LibraryException ex) {
            log.debug("Checkout of book {} by member {} rejected: {}",
                request.bookId(), request.memberId(), ex.getKind());
            throw ex;
        } catch (RuntimeException ex) {
            throw busyOrRethrow("checkout of book " + request.bookId(), ex);
        }
        log.info("Book {} checked out to member {} as borrowing {}, due {}",
            request.bookId(), request.memberId(), borrowing.getId(), borrowing.getDueDate());
        return BorrowingMapper.toResponse(borrowing, today());
    }

    public BorrowingResponse returnBorrowing(Long borrowingId) {
        Borrowing borrowing;
        try {
            borrowing = ledger.returnBorrowing(borrowingId);
        } catch (LibraryException ex) {
            log.debug("Return of borrowing {} rejected: {}", borrowingId, ex.getKind());
            throw ex;
        } catch (RuntimeException ex) {
            throw busyOrRethrow("return of borrowing " + borrowingId, ex);
        }
        log.info("Borrowing {} returned, book {} back on the shelf", borrowingId, borrowing.getBook().getId());
        return BorrowingMapper.toResponse(borrowing, today());
    }

    @Transactional(readOnly = true)
    public BorrowingResponse findById(Long borrowingId) {
        Borrowing borrowing = borrowingRepository.findByIdWithMemberAndBook(borrowingId)
            .orElseThrow(() -> new ResourceNotFoundException("Borrowing", borrowingId));
        return BorrowingMapper.toResponse(borrowing, today());
    }

    /**
     * Recomputes the copy-count invariant for one book from the borrowings table.
     *
     * @throws InventoryInconsistencyException if the counters are out of range or disagree
     *         with the number of open borrowings
     */
    @Transactional(readOnly = true)
    public InventoryResponse verifyInventory(Long bookId) {
        Book book = bookRepository.findById(bookId)
            .orElseThrow(() -> new ResourceNotFoundException("Book", bookId));
        long open = borrowingRepository.countByBookIdAndStatus(bookId, BorrowingStatus.BORROWED);

        if (book.getAvailableCopies() < 0 || book.getAvailableCopies() > book.getTotalCopies()) {
            throw new InventoryInconsistencyException("Book " + bookId + " has " + book.getAvailableCopies()
                + " available of " + book.getTotalCopies() + " total copies");
        }
        if (book.getCopiesOnLoan() != open) {
            throw new InventoryInconsistencyException("Book " + bookId + " counters show "
                + book.getCopiesOnLoan() + " copies on loan but " + open + " borrowings are open");
        }
        return new InventoryResponse(bookId, book.getTotalCopies(), book.getAvailableCopies(), open);
    }

    private int resolveLoanPeriod(Integer requested) {
        if (requested == null) {
            return properties.defaultLoanPeriodDays();
        }
        if (requested < 1 || requested > properties.maxLoanPeriodDays()) {
            throw new InvalidRequestException("Loan period must be between 1 and "
                + properties.maxLoanPeriodDays() + " days, was " + requested);
        }
        return requested;
    }

    private RuntimeException busyOrRethrow(String operation, RuntimeException cause) {
        if (!ContentionFailures.isContention(cause)) {
            return cause;
        }
        log.warn("Gave up on {}: {}", operation, cause.getMessage());
        return new LendingBusyException("The library is busy, " + operation + " was not applied; retry shortly", cause);
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
