package com.library.lending.repository;

/** All-time number of borrowings recorded for one member. */
public record MemberBorrowingCount(Long memberId, long borrowings) {}
