package com.library.lending.controller;

import com.library.lending.dto.request.CheckoutRequest;
import com.library.lending.dto.response.BorrowingResponse;
import com.library.lending.dto.response.ListResponse;
import com.library.lending.entity.BorrowingStatus;
import com.library.lending.service.LendingService;
import com.library.lending.service.LibraryQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/borrowings")
@RequiredArgsConstructor
@Tag(name = "Borrowings", description = "Checkout, return and loan history")
public class BorrowingController {

    private final LendingService lendingService;
    private final LibraryQueryService queryService;

    @PostMapping
    @Operation(summary = "Check out a book", description = "Lends one copy to an active member. "
        + "The loan period defaults to the configured value when omitted.")
    @ApiResponse(responseCode = "201", description = "Borrowing created")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "404", description = "Member or book not found")
    @ApiResponse(responseCode = "409", description = "No copies available, or member inactive")
    @ApiResponse(responseCode = "503", description = "Lending is contended; retry")
    public ResponseEntity<BorrowingResponse> checkout(@Valid @RequestBody CheckoutRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(lendingService.checkout(request));
    }

    @PatchMapping("/{id}/return")
    @Operation(summary = "Return a book", description = "Closes an open or overdue borrowing and restores the copy.")
    @ApiResponse(responseCode = "200", description = "Borrowing returned")
    @ApiResponse(responseCode = "404", description = "Borrowing not found")
    @ApiResponse(responseCode = "409", description = "Borrowing already returned")
    @ApiResponse(responseCode = "503", description = "Lending is contended; retry")
    public ResponseEntity<BorrowingResponse> returnBorrowing(@PathVariable Long id) {
        return ResponseEntity.ok(lendingService.returnBorrowing(id));
    }

    @GetMapping
    @Operation(summary = "List borrowings", description = "Borrowings with member and book names, newest first.")
    public ResponseEntity<ListResponse<BorrowingResponse>> findAll(
            @Parameter(description = "Filter by status (BORROWED, RETURNED, OVERDUE)")
            @RequestParam(required = false) BorrowingStatus status) {
        return ResponseEntity.ok(ListResponse.of(queryService.borrowingsWithNames(status)));
    }

    @GetMapping("/overdue")
    @Operation(summary = "List overdue borrowings", description = "Open loans past their due date.")
    public ResponseEntity<ListResponse<BorrowingResponse>> findOverdue() {
        return ResponseEntity.ok(ListResponse.of(queryService.overdueBorrowings()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get borrowing by ID")
    @ApiResponse(responseCode = "200", description = "Borrowing found")
    @ApiResponse(responseCode = "404", description = "Borrowing not found")
    public ResponseEntity<BorrowingResponse> findById(@PathVariable Long id) {
        return ResponseEntity.ok(lendingService.findById(id));
    }
}
