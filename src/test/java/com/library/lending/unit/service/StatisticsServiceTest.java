package com.library.lending.unit.service;

import com.library.lending.dto.response.LibraryStatsResponse;
import com.library.lending.entity.BorrowingStatus;
import com.library.lending.entity.MemberStatus;
import com.library.lending.repository.AuthorRepository;
import com.library.lending.repository.BookRepository;
import com.library.lending.repository.BorrowingRepository;
import com.library.lending.repository.MemberRepository;
import com.library.lending.service.StatisticsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StatisticsServiceTest {

    private static final Instant NOW = Instant.parse("2025-07-10T10:00:00Z");

    @Mock
    private BookRepository bookRepository;

    @Mock
    private AuthorRepository authorRepository;

    @Mock
    private MemberRepository memberRepository;

    @Mock
    private BorrowingRepository borrowingRepository;

    private StatisticsService statisticsService;

    @BeforeEach
    void setUp() {
        statisticsService = new StatisticsService(bookRepository, authorRepository, memberRepository,
            borrowingRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void computeStats_reportsStoredCountsAsTheyAre() {
        when(bookRepository.count()).thenReturn(4L);
        when(authorRepository.count()).thenReturn(6L);
        when(memberRepository.countByStatus(MemberStatus.ACTIVE)).thenReturn(3L);
        when(borrowingRepository.countByStatus(BorrowingStatus.BORROWED)).thenReturn(2L);
        when(borrowingRepository.countByStatusAndDueDateBefore(BorrowingStatus.BORROWED, LocalDate.of(2025, 7, 10)))
            .thenReturn(1L);
        when(bookRepository.sumTotalCopies()).thenReturn(18L);
        when(bookRepository.sumAvailableCopies()).thenReturn(14L);

        LibraryStatsResponse stats = statisticsService.computeStats();

        assertThat(stats.totalBooks()).isEqualTo(4L);
        assertThat(stats.totalAuthors()).isEqualTo(6L);
        assertThat(stats.totalMembers()).isEqualTo(3L);
        assertThat(stats.activeBorrowings()).isEqualTo(2L);
        assertThat(stats.overdueBorrowings()).isEqualTo(1L);
        assertThat(stats.totalCopies()).isEqualTo(18L);
        assertThat(stats.availableCopies()).isEqualTo(14L);
        assertThat(stats.generatedAt()).isEqualTo(NOW);
    }

    @Test
    void computeStats_whenStoreFails_propagates() {
        when(bookRepository.count()).thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> statisticsService.computeStats())
            .isInstanceOf(DataAccessResourceFailureException.class);
    }
}
