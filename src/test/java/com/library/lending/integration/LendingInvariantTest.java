package com.library.lending.integration;

import com.library.lending.dto.request.CheckoutRequest;
import com.library.lending.dto.request.CreateAuthorRequest;
import com.library.lending.dto.request.CreateBookRequest;
import com.library.lending.dto.request.CreateMemberRequest;
import com.library.lending.dto.response.BookResponse;
import com.library.lending.dto.response.BorrowingResponse;
import com.library.lending.dto.response.InventoryResponse;
import com.library.lending.dto.response.LibraryStatsResponse;
import com.library.lending.entity.BorrowingStatus;
import com.library.lending.entity.MemberStatus;
import com.library.lending.exception.AlreadyReturnedException;
import com.library.lending.exception.ErrorKind;
import com.library.lending.exception.InventoryInconsistencyException;
import com.library.lending.exception.LendingBusyException;
import com.library.lending.exception.MemberInactiveException;
import com.library.lending.exception.NoCopiesAvailableException;
import com.library.lending.service.AuthorService;
import com.library.lending.service.BookService;
import com.library.lending.service.LendingService;
import com.library.lending.service.MemberService;
import com.library.lending.service.StatisticsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Ledger invariants against an in-memory H2 database, so they run without Docker.
 * The schema comes from the entity mappings rather than the Flyway migrations.
 */
@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.NONE,
    properties = {
        "spring.flyway.enabled=false",
        "spring.jpa.hibernate.ddl-auto=create-drop",
        "spring.datasource.url=jdbc:h2:mem:lending;DB_CLOSE_DELAY=-1",
        "spring.datasource.driver-class-name=org.h2.Driver",
        "spring.datasource.username=sa",
        "spring.datasource.password=",
        "spring.datasource.hikari.connection-init-sql=SET LOCK_TIMEOUT 2000",
        "spring.jpa.database-platform=org.hibernate.dialect.H2Dialect",
        "library.lending.transaction-timeout-seconds=2"
    }
)
class LendingInvariantTest {

    @Autowired
    private LendingService lendingService;

    @Autowired
    private BookService bookService;

    @Autowired
    private AuthorService authorService;

    @Autowired
    private MemberService memberService;

    @Autowired
    private StatisticsService statisticsService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private DataSource dataSource;

    @Value("${library.lending.transaction-timeout-seconds}")
    private int timeoutSeconds;

    @BeforeEach
    void cleanDatabase() {
        jdbcTemplate.update("DELETE FROM borrowings");
        jdbcTemplate.update("DELETE FROM book_authors");
        jdbcTemplate.update("DELETE FROM books");
        jdbcTemplate.update("DELETE FROM authors");
        jdbcTemplate.update("DELETE FROM categories");
        jdbcTemplate.update("DELETE FROM members");
    }

    @Test
    void concurrentCheckoutsOfSingleCopy_exactlyOneSucceeds() throws Exception {
        Long bookId = createBook("9780134685991", "Effective Java", 1);
        int threadCount = 8;
        List<Long> memberIds = new ArrayList<>();
        for (int i = 0; i < threadCount; i++) {
            memberIds.add(createMember("reader" + i + "@email.com"));
        }

        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Future<BorrowingResponse>> futures = new ArrayList<>();
        for (Long memberId : memberIds) {
            futures.add(executor.submit(() -> {
                startLatch.await();
                return lendingService.checkout(new CheckoutRequest(memberId, bookId, null));
            }));
        }
        startLatch.countDown();

        int successes = 0;
        int noCopies = 0;
        for (Future<BorrowingResponse> future : futures) {
            try {
                future.get();
                successes++;
            } catch (ExecutionException ex) {
                assertThat(ex.getCause()).isInstanceOf(NoCopiesAvailableException.class);
                noCopies++;
            }
        }
        executor.shutdown();

        assertThat(successes).isEqualTo(1);
        assertThat(noCopies).isEqualTo(threadCount - 1);
        InventoryResponse inventory = lendingService.verifyInventory(bookId);
        assertThat(inventory.availableCopies()).isZero();
        assertThat(inventory.activeBorrowings()).isEqualTo(1);
    }

    @Test
    void concurrentReturnsOfSameBorrowing_restoreOneCopy() throws Exception {
        Long bookId = createBook("9780134685991", "Effective Java", 2);
        Long memberId = createMember("alice@email.com");
        Long borrowingId = lendingService.checkout(new CheckoutRequest(memberId, bookId, null)).id();

        int threadCount = 4;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Future<BorrowingResponse>> futures = new ArrayList<>();
        for (int i = 0; i < threadCount; i++) {
            futures.add(executor.submit(() -> {
                startLatch.await();
                return lendingService.returnBorrowing(borrowingId);
            }));
        }
        startLatch.countDown();

        int successes = 0;
        for (Future<BorrowingResponse> future : futures) {
            try {
                future.get();
                successes++;
            } catch (ExecutionException ex) {
                assertThat(ex.getCause()).isInstanceOf(AlreadyReturnedException.class);
            }
        }
        executor.shutdown();

        assertThat(successes).isEqualTo(1);
        InventoryResponse inventory = lendingService.verifyInventory(bookId);
        assertThat(inventory.availableCopies()).isEqualTo(2);
        assertThat(inventory.activeBorrowings()).isZero();
    }

    @Test
    void checkoutThenReturn_restoresCounterAndSecondReturnIsRejected() {
        Long bookId = createBook("9780321125217", "Domain-Driven Design", 3);
        Long memberId = createMember("alice@email.com");

        BorrowingResponse borrowed = lendingService.checkout(new CheckoutRequest(memberId, bookId, 14));
        assertThat(bookService.findById(bookId).availableCopies()).isEqualTo(2);

        BorrowingResponse returned = lendingService.returnBorrowing(borrowed.id());
        assertThat(returned.status()).isEqualTo(BorrowingStatus.RETURNED);
        assertThat(returned.returnDate()).isNotNull();
        assertThat(bookService.findById(bookId).availableCopies()).isEqualTo(3);

        assertThatThrownBy(() -> lendingService.returnBorrowing(borrowed.id()))
            .isInstanceOf(AlreadyReturnedException.class);
        assertThat(bookService.findById(bookId).availableCopies()).isEqualTo(3);
    }

    @Test
    void cleanCodeWithTwoOpenLoans_inactiveMemberIsRejectedAndActiveMemberSucceeds() {
        Long authorId = authorService.create(new CreateAuthorRequest("Robert", "Martin", null, "American")).id();
        Long bookId = bookService.create(new CreateBookRequest("9780132350884", "Clean Code", 2008,
            "Prentice Hall", 5, null, null, List.of(authorId))).id();
        lendingService.checkout(new CheckoutRequest(createMember("alice@email.com"), bookId, null));
        lendingService.checkout(new CheckoutRequest(createMember("bob@email.com"), bookId, null));
        assertThat(bookService.findById(bookId).availableCopies()).isEqualTo(3);

        Long inactiveId = createMember("carol@email.com");
        memberService.updateStatus(inactiveId, MemberStatus.INACTIVE);

        assertThatThrownBy(() -> lendingService.checkout(new CheckoutRequest(inactiveId, bookId, null)))
            .isInstanceOf(MemberInactiveException.class);
        assertThat(bookService.findById(bookId).availableCopies()).isEqualTo(3);

        BorrowingResponse third = lendingService.checkout(
            new CheckoutRequest(createMember("david@email.com"), bookId, null));
        assertThat(third.status()).isEqualTo(BorrowingStatus.BORROWED);

        BookResponse book = bookService.findById(bookId);
        assertThat(book.availableCopies()).isEqualTo(2);
        assertThat(book.authors()).containsExactly("Robert Martin");
        assertThat(lendingService.verifyInventory(bookId).activeBorrowings()).isEqualTo(3);
    }

    @Test
    void bookWithZeroCopies_rejectsCheckoutRegardlessOfMemberStatus() {
        Long bookId = createBook("9780201633610", "Design Patterns", 0);
        Long activeId = createMember("alice@email.com");
        Long inactiveId = createMember("bob@email.com");
        memberService.updateStatus(inactiveId, MemberStatus.INACTIVE);

        assertThatThrownBy(() -> lendingService.checkout(new CheckoutRequest(activeId, bookId, null)))
            .isInstanceOf(NoCopiesAvailableException.class);
        assertThatThrownBy(() -> lendingService.checkout(new CheckoutRequest(inactiveId, bookId, null)))
            .isInstanceOf(NoCopiesAvailableException.class);

        InventoryResponse inventory = lendingService.verifyInventory(bookId);
        assertThat(inventory.totalCopies()).isZero();
        assertThat(inventory.availableCopies()).isZero();
    }

    @Test
    void bookCreatedWithCopiesOutButNoLoans_failsInventoryVerification() {
        Long bookId = bookService.create(new CreateBookRequest("9780132350884", "Clean Code", null, null,
            5, 3, null, null)).id();

        assertThatThrownBy(() -> lendingService.verifyInventory(bookId))
            .isInstanceOfSatisfying(InventoryInconsistencyException.class,
                ex -> assertThat(ex.getKind()).isEqualTo(ErrorKind.INTERNAL_INCONSISTENCY));
    }

    @Test
    void stats_trackCopiesOnLoan() {
        Long first = createBook("9780132350884", "Clean Code", 5);
        Long second = createBook("9780321125217", "Domain-Driven Design", 3);
        Long memberId = createMember("alice@email.com");
        lendingService.checkout(new CheckoutRequest(memberId, first, null));
        lendingService.checkout(new CheckoutRequest(memberId, second, null));

        LibraryStatsResponse stats = statisticsService.computeStats();

        assertThat(stats.totalBooks()).isEqualTo(2);
        assertThat(stats.totalMembers()).isEqualTo(1);
        assertThat(stats.activeBorrowings()).isEqualTo(2);
        assertThat(stats.overdueBorrowings()).isZero();
        assertThat(stats.totalCopies()).isEqualTo(8);
        assertThat(stats.availableCopies()).isEqualTo(6);
    }

    @Test
    void checkoutBlockedOnBookRowLock_givesUpAsBusyWithinTimeout() throws Exception {
        Long bookId = createBook("9780134685991", "Effective Java", 1);
        Long memberId = createMember("alice@email.com");
        long holdMillis = timeoutSeconds * 3000L;

        ExecutorService executor = Executors.newSingleThreadExecutor();
        CountDownLatch locked = new CountDownLatch(1);
        Future<?> holder = executor.submit(() -> {
            try (Connection connection = dataSource.getConnection()) {
                connection.setAutoCommit(false);
                try (PreparedStatement update = connection.prepareStatement(
                        "UPDATE books SET available_copies = available_copies WHERE id = ?")) {
                    update.setLong(1, bookId);
                    update.executeUpdate();
                }
                locked.countDown();
                Thread.sleep(holdMillis);
                connection.rollback();
            }
            return null;
        });
        assertThat(locked.await(5, TimeUnit.SECONDS)).isTrue();

        long start = System.nanoTime();
        assertThatThrownBy(() -> lendingService.checkout(new CheckoutRequest(memberId, bookId, null)))
            .isInstanceOf(LendingBusyException.class)
            .hasMessageContaining("checkout of book " + bookId);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        holder.get();
        executor.shutdown();

        assertThat(elapsedMillis).isLessThan(holdMillis);
        assertThat(bookService.findById(bookId).availableCopies()).isEqualTo(1);
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM borrowings", Long.class)).isZero();
    }

    @Test
    void stats_reportStoredCountsAsTheyAre() {
        bookService.create(new CreateBookRequest("9780132350884", "Clean Code", null, null, 5, 3, null, null));
        Long ddd = bookService.create(new CreateBookRequest("9780321125217", "Domain-Driven Design", null, null,
            3, 2, null, null)).id();
        bookService.create(new CreateBookRequest("9780201633610", "Design Patterns", null, null, 4, 4, null, null));
        Long effectiveJava = bookService.create(new CreateBookRequest("9780134685991", "Effective Java", null, null,
            6, 5, null, null)).id();
        Long memberId = createMember("alice@email.com");
        LocalDate today = LocalDate.now();
        for (Long bookId : List.of(ddd, effectiveJava)) {
            jdbcTemplate.update("INSERT INTO borrowings (member_id, book_id, borrow_date, due_date, status, "
                + "created_at, updated_at) VALUES (?, ?, ?, ?, 'BORROWED', CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)",
                memberId, bookId, today, today.plusDays(30));
        }

        LibraryStatsResponse stats = statisticsService.computeStats();

        assertThat(stats.totalBooks()).isEqualTo(4);
        assertThat(stats.totalCopies()).isEqualTo(18);
        assertThat(stats.availableCopies()).isEqualTo(14);
        assertThat(stats.activeBorrowings()).isEqualTo(2);
        assertThat(stats.overdueBorrowings()).isZero();
    }

    private Long createBook(String isbn, String title, int copies) {
        return bookService.create(new CreateBookRequest(isbn, title, null, null, copies, null, null, null)).id();
    }

    private Long createMember(String email) {
        return memberService.create(new CreateMemberRequest("Reader", email.substring(0, email.indexOf('@')),
            email, null, null)).id();
    }
}
