package com.library.lending.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;

/**
 * One loan of one copy of a {@link Book} to a {@link Member}.
 *
 * <p>Created by checkout as {@link BorrowingStatus#BORROWED} with no return date, and
 * changed at most once more, by return, to {@link BorrowingStatus#RETURNED} with the
 * return date set. The pairing {@code return_date IS NOT NULL <=> status = 'RETURNED'} is
 * a CHECK constraint in V3.
 *
 * <p>The stored status is never {@link BorrowingStatus#OVERDUE}; see
 * {@link #effectiveStatus(LocalDate)}.
 */
@Entity
@Table(name = "borrowings")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Borrowing extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "member_id", nullable = false)
    private Member member;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "book_id", nullable = false)
    private Book book;

    @Column(name = "borrow_date", nullable = false, updatable = false)
    private LocalDate borrowDate;

    @Column(name = "due_date", nullable = false)
    private LocalDate dueDate;

    @Column(name = "return_date")
    private LocalDate returnDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BorrowingStatus status;

    /**
     * Status as reported to readers: a {@code BORROWED} loan whose due date is before
     * {@code today} is {@code OVERDUE}.
     */
    public BorrowingStatus effectiveStatus(LocalDate today) {
        if (status == BorrowingStatus.BORROWED && dueDate.isBefore(today)) {
            return BorrowingStatus.OVERDUE;
        }
        return status;
    }
}
