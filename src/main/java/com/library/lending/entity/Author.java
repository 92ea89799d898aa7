package com.library.lending.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.BatchSize;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.Set;

/**
 * A book author.
 *
 * <p>Author is the inverse side of the Book-Author many-to-many; the
 * {@code book_authors} join table is written only through {@link Book#getAuthors()}.
 * {@code books} is lazy and loaded by a fetch join when the author list view is built.
 *
 * <p>No {@code @ToString}: the default would walk {@code books} and trigger a lazy load
 * outside a transaction.
 */
@Entity
@Table(name = "authors")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Author extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "first_name", nullable = false, length = 50)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 50)
    private String lastName;

    @Column(name = "birth_date")
    private LocalDate birthDate;

    @Column(name = "nationality", length = 50)
    private String nationality;

    @ManyToMany(mappedBy = "authors", fetch = FetchType.LAZY)
    @BatchSize(size = 20)
    private Set<Book> books = new HashSet<>();

    /** "First Last", the form used in every composed view. */
    public String getDisplayName() {
        return firstName + " " + lastName;
    }
}
