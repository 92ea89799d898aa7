package com.library.lending.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * {@code loanPeriodDays} falls back to {@code library.lending.default-loan-period-days}
 * when omitted. The upper bound is checked by the service against configuration.
 */
public record CheckoutRequest(

    @NotNull(message = "Member ID is required")
    Long memberId,

    @NotNull(message = "Book ID is required")
    Long bookId,

    @Min(value = 1, message = "Loan period must be at least one day")
    Integer loanPeriodDays
) {}
