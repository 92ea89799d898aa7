package com.library.lending.dto.response;

import java.util.List;

/** Book with its category name and author display names, ordered by author last name. */
public record BookResponse(
    Long id,
    String isbn,
    String title,
    Integer publicationYear,
    String publisher,
    int totalCopies,
    int availableCopies,
    String categoryName,
    List<String> authors
) {}
