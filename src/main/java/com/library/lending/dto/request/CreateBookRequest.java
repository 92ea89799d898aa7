package com.library.lending.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * {@code availableCopies} may be omitted, in which case every copy starts on the shelf.
 * {@code authorIds} may be omitted or empty.
 */
public record CreateBookRequest(

    @NotBlank(message = "ISBN must not be blank")
    @Pattern(regexp = "\\d{13}|\\d{9}[\\dX]", message = "ISBN must be 13 digits, or 10 characters for ISBN-10")
    String isbn,

    @NotBlank(message = "Title must not be blank")
    @Size(max = 200, message = "Title must not exceed 200 characters")
    String title,

    @Min(value = 1000, message = "Publication year must be 1000 or later")
    @Max(value = 2100, message = "Publication year must be 2100 or earlier")
    Integer publicationYear,

    @Size(max = 100, message = "Publisher must not exceed 100 characters")
    String publisher,

    @NotNull(message = "Total copies is required")
    @Min(value = 0, message = "Total copies must not be negative")
    Integer totalCopies,

    @Min(value = 0, message = "Available copies must not be negative")
    Integer availableCopies,

    Long categoryId,

    List<@NotNull Long> authorIds
) {}
