package com.library.lending.dto.response;

import java.time.Instant;

/** {@code totalMembers} counts ACTIVE members only; {@code activeBorrowings} includes overdue ones. */
public record LibraryStatsResponse(
    long totalBooks,
    long totalAuthors,
    long totalMembers,
    long activeBorrowings,
    long overdueBorrowings,
    long totalCopies,
    long availableCopies,
    Instant generatedAt
) {}
