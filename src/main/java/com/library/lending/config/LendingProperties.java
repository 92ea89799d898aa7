package com.library.lending.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Loan-period settings under {@code library.lending}.
 *
 * <p>The transaction timeout for checkout and return,
 * {@code library.lending.transaction-timeout-seconds}, is read directly by the
 * {@code @Transactional} declarations in {@code LendingLedger}.
 *
 * @param defaultLoanPeriodDays loan length used when a checkout does not name one
 * @param maxLoanPeriodDays     longest loan a checkout may request
 */
@Validated
@ConfigurationProperties(prefix = "library.lending")
public record LendingProperties(

    @DefaultValue("30")
    @Min(1)
    int defaultLoanPeriodDays,

    @DefaultValue("90")
    @Min(1)
    int maxLoanPeriodDays
) {}
