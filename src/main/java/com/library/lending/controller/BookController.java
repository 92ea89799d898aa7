package com.library.lending.controller;

import com.library.lending.dto.request.CreateBookRequest;
import com.library.lending.dto.response.BookResponse;
import com.library.lending.dto.response.InventoryResponse;
import com.library.lending.dto.response.ListResponse;
import com.library.lending.service.BookService;
import com.library.lending.service.LendingService;
import com.library.lending.service.LibraryQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/books")
@RequiredArgsConstructor
@Tag(name = "Books", description = "Catalog of books and their copy counts")
public class BookController {

    private final BookService bookService;
    private final LibraryQueryService queryService;
    private final LendingService lendingService;

    @GetMapping
    @Operation(summary = "List all books", description = "Books with category and author names, ordered by title.")
    public ResponseEntity<ListResponse<BookResponse>> findAll() {
        return ResponseEntity.ok(ListResponse.of(queryService.booksWithAuthorsAndCategory()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get book by ID")
    @ApiResponse(responseCode = "200", description = "Book found")
    @ApiResponse(responseCode = "404", description = "Book not found")
    public ResponseEntity<BookResponse> findById(@PathVariable Long id) {
        return ResponseEntity.ok(bookService.findById(id));
    }

    @PostMapping
    @Operation(summary = "Add a book", description = "ISBN must be unique. Available copies default to total copies "
        + "and may not exceed them.")
    @ApiResponse(responseCode = "201", description = "Book created")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "404", description = "Category or author not found")
    @ApiResponse(responseCode = "409", description = "ISBN already exists")
    public ResponseEntity<BookResponse> create(@Valid @RequestBody CreateBookRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(bookService.create(request));
    }

    @GetMapping("/{id}/inventory")
    @Operation(summary = "Verify copy counts", description = "Checks the book's counters against its open borrowings.")
    @ApiResponse(responseCode = "200", description = "Counters are consistent")
    @ApiResponse(responseCode = "404", description = "Book not found")
    @ApiResponse(responseCode = "500", description = "Counters disagree with open borrowings")
    public ResponseEntity<InventoryResponse> verifyInventory(@PathVariable Long id) {
        return ResponseEntity.ok(lendingService.verifyInventory(id));
    }
}
