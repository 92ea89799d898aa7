package com.library.lending.dto.response;

public record InventoryResponse(
    Long bookId,
    int totalCopies,
    int availableCopies,
    long activeBorrowings
) {}
