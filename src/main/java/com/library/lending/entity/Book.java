package com.library.lending.entity;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.JoinTable;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.BatchSize;

import java.util.HashSet;
import java.util.Set;

/**
 * A catalogued title and its copy counters.
 *
 * <p><strong>Copy counters</strong>: {@code totalCopies} is the number of copies the
 * library owns; {@code availableCopies} the number not currently lent out. At all times
 * {@code 0 <= availableCopies <= totalCopies} (also a CHECK constraint in V1) and
 * {@code totalCopies - availableCopies} equals the number of {@code BORROWED}
 * borrowings of this book.
 *
 * <p>After creation {@code availableCopies} is written only by the conditional updates in
 * {@code BookRepository} that {@code LendingService} issues during checkout and return.
 * Those statements run as bulk JPQL, so a {@code Book} already loaded in the same
 * persistence context keeps the pre-update value; re-read it if the current count matters.
 *
 * <p><strong>Authors</strong>: Book owns the {@code book_authors} join table, whose
 * primary key is {@code (book_id, author_id)}. PERSIST/MERGE cascade to authors; REMOVE
 * does not.
 */
@Entity
@Table(name = "books")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EqualsAndHashCode(of = "id", callSuper = false)
public class Book extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** ISBN-10 or ISBN-13, unique ({@code uk_books_isbn}). */
    @Column(name = "isbn", nullable = false, unique = true, length = 13)
    private String isbn;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "publication_year")
    private Integer publicationYear;

    @Column(name = "publisher", length = 100)
    private String publisher;

    @Column(name = "total_copies", nullable = false)
    private int totalCopies;

    @Column(name = "available_copies", nullable = false)
    private int availableCopies;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "category_id")
    private Category category;

    @ManyToMany(fetch = FetchType.LAZY, cascade = {CascadeType.PERSIST, CascadeType.MERGE})
    @JoinTable(
            name = "book_authors",
            joinColumns = @JoinColumn(name = "book_id"),
            inverseJoinColumns = @JoinColumn(name = "author_id")
    )
    @BatchSize(size = 20)
    private Set<Author> authors = new HashSet<>();

    public Book(String isbn, String title, int totalCopies, int availableCopies) {
        this.isbn = isbn;
        this.title = title;
        this.totalCopies = totalCopies;
        this.availableCopies = availableCopies;
    }

    /** Copies currently out on loan, as implied by the counters. */
    public int getCopiesOnLoan() {
        return totalCopies - availableCopies;
    }
}
