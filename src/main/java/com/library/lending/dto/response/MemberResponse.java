package com.library.lending.dto.response;

import com.library.lending.entity.MemberStatus;

import java.time.LocalDate;

/** {@code totalBorrowings} counts every borrowing the member ever made, returned or not. */
public record MemberResponse(
    Long id,
    String firstName,
    String lastName,
    String name,
    String email,
    String phone,
    String address,
    MemberStatus status,
    LocalDate membershipDate,
    long totalBorrowings
) {}
