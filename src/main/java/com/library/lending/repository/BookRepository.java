package com.library.lending.repository;

import com.library.lending.entity.Book;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface BookRepository extends JpaRepository<Book, Long> {

    @Query("SELECT b FROM Book b LEFT JOIN FETCH b.category LEFT JOIN FETCH b.authors WHERE b.id = :id")
    Optional<Book> findByIdWithCategoryAndAuthors(@Param("id") Long id);

    @Query("SELECT b FROM Book b LEFT JOIN FETCH b.category LEFT JOIN FETCH b.authors ORDER BY b.title ASC, b.id ASC")
    List<Book> findAllWithCategoryAndAuthorsOrderedByTitle();

    boolean existsByIsbn(String isbn);

    /**
     * Takes one copy off the shelf if, and only if, one is available. The row lock taken
     * by the UPDATE serialises racing checkouts; a caller that loses the race for the last
     * copy re-evaluates the predicate against the committed count and gets {@code 0}.
     *
     * @return number of rows changed: {@code 1} on success, {@code 0} if no copy was available
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Book b SET b.availableCopies = b.availableCopies - 1, b.updatedAt = :now "
        + "WHERE b.id = :id AND b.availableCopies > 0")
    int decrementAvailableCopies(@Param("id") Long id, @Param("now") Instant now);

    /**
     * Puts one copy back on the shelf, never beyond {@code totalCopies}.
     *
     * @return {@code 1} on success, {@code 0} if the book already shows every copy available
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Book b SET b.availableCopies = b.availableCopies + 1, b.updatedAt = :now "
        + "WHERE b.id = :id AND b.availableCopies < b.totalCopies")
    int incrementAvailableCopies(@Param("id") Long id, @Param("now") Instant now);

    @Query("SELECT COALESCE(SUM(b.totalCopies), 0L) FROM Book b")
    long sumTotalCopies();

    @Query("SELECT COALESCE(SUM(b.availableCopies), 0L) FROM Book b")
    long sumAvailableCopies();
}
