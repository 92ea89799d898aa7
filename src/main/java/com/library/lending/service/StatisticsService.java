package com.library.lending.service;

import com.library.lending.dto.response.LibraryStatsResponse;
import com.library.lending.entity.BorrowingStatus;
import com.library.lending.entity.MemberStatus;
import com.library.lending.repository.AuthorRepository;
import com.library.lending.repository.BookRepository;
import com.library.lending.repository.BorrowingRepository;
import com.library.lending.repository.MemberRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;

@Service
@RequiredArgsConstructor
public class StatisticsService {

    private final BookRepository bookRepository;
    private final AuthorRepository authorRepository;
    private final MemberRepository memberRepository;
    private final BorrowingRepository borrowingRepository;
    private final Clock clock;

    /**
     * Library-wide counts, read in one read-only transaction. Repository failures propagate
     * unchanged.
     */
    @Transactional(readOnly = true)
    public LibraryStatsResponse computeStats() {
        Instant generatedAt = Instant.now(clock);
        LocalDate today = LocalDate.now(clock);

        return new LibraryStatsResponse(
            bookRepository.count(),
            authorRepository.count(),
            memberRepository.countByStatus(MemberStatus.ACTIVE),
            borrowingRepository.countByStatus(BorrowingStatus.BORROWED),
            borrowingRepository.countByStatusAndDueDateBefore(BorrowingStatus.BORROWED, today),
            bookRepository.sumTotalCopies(),
            bookRepository.sumAvailableCopies(),
            generatedAt
        );
    }
}
