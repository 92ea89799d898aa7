package com.library.lending.service;

import com.library.lending.dto.response.BookResponse;
import com.library.lending.dto.response.BorrowingResponse;
import com.library.lending.dto.response.MemberResponse;
import com.library.lending.entity.BorrowingStatus;
import com.library.lending.mapper.BookMapper;
import com.library.lending.mapper.BorrowingMapper;
import com.library.lending.mapper.MemberMapper;
import com.library.lending.repository.BookRepository;
import com.library.lending.repository.BorrowingRepository;
import com.library.lending.repository.MemberBorrowingCount;
import com.library.lending.repository.MemberRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Joined read views over catalog, membership and borrowings. Read-only.
 */
@Service
@RequiredArgsConstructor
public class LibraryQueryService {

    private final BookRepository bookRepository;
    private final MemberRepository memberRepository;
    private final BorrowingRepository borrowingRepository;
    private final Clock clock;

    /** Every book with its category and authors, ordered by title. */
    @Transactional(readOnly = true)
    public List<BookResponse> booksWithAuthorsAndCategory() {
        return bookRepository.findAllWithCategoryAndAuthorsOrderedByTitle().stream()
            .map(BookMapper::toResponse)
            .toList();
    }

    /** Every member with the all-time number of borrowings, ordered by last then first name. */
    @Transactional(readOnly = true)
    public List<MemberResponse> membersWithLoanCount() {
        Map<Long, Long> counts = borrowingRepository.countAllByMember().stream()
            .collect(Collectors.toMap(MemberBorrowingCount::memberId, MemberBorrowingCount::borrowings));

        return memberRepository.findAllByOrderByLastNameAscFirstNameAscIdAsc().stream()
            .map(member -> MemberMapper.toResponse(member, counts.getOrDefault(member.getId(), 0L)))
            .toList();
    }

    /**
     * Borrowings with member and book names, newest first.
     *
     * @param status optional filter on the stored status; {@code OVERDUE} selects open loans
     *               past their due date, {@code BORROWED} selects every open loan
     */
    @Transactional(readOnly = true)
    public List<BorrowingResponse> borrowingsWithNames(BorrowingStatus status) {
        if (status == BorrowingStatus.OVERDUE) {
            return overdueBorrowings();
        }
        LocalDate today = LocalDate.now(clock);
        var borrowings = status == null
            ? borrowingRepository.findAllWithMemberAndBook()
            : borrowingRepository.findAllWithMemberAndBookByStatus(status);
        return borrowings.stream()
            .map(borrowing -> BorrowingMapper.toResponse(borrowing, today))
            .toList();
    }

    /** Open loans past their due date, longest overdue first. */
    @Transactional(readOnly = true)
    public List<BorrowingResponse> overdueBorrowings() {
        LocalDate today = LocalDate.now(clock);
        return borrowingRepository.findOverdue(BorrowingStatus.BORROWED, today).stream()
            .map(borrowing -> BorrowingMapper.toResponse(borrowing, today))
            .toList();
    }
}
