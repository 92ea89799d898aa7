package com.library.lending.repository;

import com.library.lending.entity.Author;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface AuthorRepository extends JpaRepository<Author, Long> {

    @Query("SELECT a FROM Author a LEFT JOIN FETCH a.books WHERE a.id = :id")
    Optional<Author> findByIdWithBooks(@Param("id") Long id);

    @Query("SELECT a FROM Author a LEFT JOIN FETCH a.books ORDER BY a.lastName ASC, a.firstName ASC, a.id ASC")
    List<Author> findAllWithBooksOrderedByName();
}
