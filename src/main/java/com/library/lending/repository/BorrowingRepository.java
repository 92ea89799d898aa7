package com.library.lending.repository;

import com.library.lending.entity.Borrowing;
import com.library.lending.entity.BorrowingStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface BorrowingRepository extends JpaRepository<Borrowing, Long> {

    @Query("SELECT br FROM Borrowing br JOIN FETCH br.member JOIN FETCH br.book WHERE br.id = :id")
    Optional<Borrowing> findByIdWithMemberAndBook(@Param("id") Long id);

    @Query("SELECT br FROM Borrowing br JOIN FETCH br.member JOIN FETCH br.book "
        + "ORDER BY br.borrowDate DESC, br.id DESC")
    List<Borrowing> findAllWithMemberAndBook();

    @Query("SELECT br FROM Borrowing br JOIN FETCH br.member JOIN FETCH br.book "
        + "WHERE br.status = :status ORDER BY br.borrowDate DESC, br.id DESC")
    List<Borrowing> findAllWithMemberAndBookByStatus(@Param("status") BorrowingStatus status);

    @Query("SELECT br FROM Borrowing br JOIN FETCH br.member JOIN FETCH br.book "
        + "WHERE br.status = :borrowed AND br.dueDate < :today ORDER BY br.dueDate ASC, br.id ASC")
    List<Borrowing> findOverdue(@Param("borrowed") BorrowingStatus borrowed,
                                @Param("today") LocalDate today);

    long countByStatus(BorrowingStatus status);

    long countByBookIdAndStatus(Long bookId, BorrowingStatus status);

    long countByMemberId(Long memberId);

    long countByStatusAndDueDateBefore(BorrowingStatus status, LocalDate date);

    @Query("SELECT new com.library.lending.repository.MemberBorrowingCount(br.member.id, COUNT(br)) "
        + "FROM Borrowing br GROUP BY br.member.id")
    List<MemberBorrowingCount> countAllByMember();

    /**
     * Closes an open loan. Guarded by {@code status = from} so that of two racing returns
     * only one changes the row.
     *
     * <p>Clears the persistence context afterwards: any {@link Borrowing} loaded earlier in
     * the transaction no longer reflects the row.
     *
     * @return {@code 1} if the loan was open and is now closed, {@code 0} otherwise
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Borrowing br SET br.status = :to, br.returnDate = :returnDate, br.updatedAt = :now "
        + "WHERE br.id = :id AND br.status = :from")
    int transitionStatus(@Param("id") Long id,
                         @Param("from") BorrowingStatus from,
                         @Param("to") BorrowingStatus to,
                         @Param("returnDate") LocalDate returnDate,
                         @Param("now") Instant now);
}
