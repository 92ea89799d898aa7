package com.library.lending.mapper;

import com.library.lending.dto.request.CreateAuthorRequest;
import com.library.lending.dto.response.AuthorResponse;
import com.library.lending.entity.Author;
import com.library.lending.entity.Book;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;

public final class AuthorMapper {

    private AuthorMapper() {}

    public static Author toEntity(CreateAuthorRequest request) {
        Author author = new Author();
        author.setFirstName(request.firstName().trim());
        author.setLastName(request.lastName().trim());
        author.setBirthDate(request.birthDate());
        author.setNationality(request.nationality());
        return author;
    }

    public static AuthorResponse toResponse(Author author) {
        List<AuthorResponse.BookSummary> books = author.getBooks() != null
            ? author.getBooks().stream()
                .sorted(Comparator.comparing(Book::getTitle).thenComparing(Book::getId))
                .map(book -> new AuthorResponse.BookSummary(book.getId(), book.getTitle()))
                .toList()
            : Collections.emptyList();

        return new AuthorResponse(
            author.getId(),
            author.getFirstName(),
            author.getLastName(),
            author.getBirthDate(),
            author.getNationality(),
            books.size(),
            books,
            author.getCreatedAt()
        );
    }
}
