package com.library.lending.dto.response;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record AuthorResponse(
    Long id,
    String firstName,
    String lastName,
    LocalDate birthDate,
    String nationality,
    int bookCount,
    List<BookSummary> books,
    Instant createdAt
) {
    public record BookSummary(Long id, String title) {}
}
