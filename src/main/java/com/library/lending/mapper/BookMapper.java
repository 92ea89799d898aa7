package com.library.lending.mapper;

import com.library.lending.dto.request.CreateBookRequest;
import com.library.lending.dto.response.BookResponse;
import com.library.lending.entity.Author;
import com.library.lending.entity.Book;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;

public final class BookMapper {

    private static final Comparator<Author> AUTHOR_ORDER = Comparator
        .comparing(Author::getLastName)
        .thenComparing(Author::getFirstName)
        .thenComparing(Author::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private BookMapper() {}

    /** Counts are passed in already resolved and checked by {@code BookService}. */
    public static Book toEntity(CreateBookRequest request, int totalCopies, int availableCopies) {
        Book book = new Book(request.isbn(), request.title().trim(), totalCopies, availableCopies);
        book.setPublicationYear(request.publicationYear());
        book.setPublisher(request.publisher());
        return book;
    }

    public static BookResponse toResponse(Book book) {
        List<String> authors = book.getAuthors() != null
            ? book.getAuthors().stream()
                .sorted(AUTHOR_ORDER)
                .map(Author::getDisplayName)
                .toList()
            : Collections.emptyList();

        return new BookResponse(
            book.getId(),
            book.getIsbn(),
            book.getTitle(),
            book.getPublicationYear(),
            book.getPublisher(),
            book.getTotalCopies(),
            book.getAvailableCopies(),
            book.getCategory() != null ? book.getCategory().getName() : null,
            authors
        );
    }
}
