package com.library.lending.controller;

import com.library.lending.dto.request.CreateMemberRequest;
import com.library.lending.dto.request.UpdateMemberStatusRequest;
import com.library.lending.dto.response.ListResponse;
import com.library.lending.dto.response.MemberResponse;
import com.library.lending.service.LibraryQueryService;
import com.library.lending.service.MemberService;
import io.swagger.v3.oas.annotations.Operation;
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
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/members")
@RequiredArgsConstructor
@Tag(name = "Members", description = "Library membership")
public class MemberController {

    private final MemberService memberService;
    private final LibraryQueryService queryService;

    @GetMapping
    @Operation(summary = "List all members", description = "Ordered by last name, then first name, "
        + "with the all-time number of borrowings.")
    public ResponseEntity<ListResponse<MemberResponse>> findAll() {
        return ResponseEntity.ok(ListResponse.of(queryService.membersWithLoanCount()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get member by ID")
    @ApiResponse(responseCode = "200", description = "Member found")
    @ApiResponse(responseCode = "404", description = "Member not found")
    public ResponseEntity<MemberResponse> findById(@PathVariable Long id) {
        return ResponseEntity.ok(memberService.findById(id));
    }

    @PostMapping
    @Operation(summary = "Register a member", description = "New members start ACTIVE.")
    @ApiResponse(responseCode = "201", description = "Member created")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "409", description = "Email already registered")
    public ResponseEntity<MemberResponse> create(@Valid @RequestBody CreateMemberRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(memberService.create(request));
    }

    @PatchMapping("/{id}/status")
    @Operation(summary = "Activate or deactivate a member", description = "Inactive members cannot check out books.")
    @ApiResponse(responseCode = "200", description = "Status updated")
    @ApiResponse(responseCode = "404", description = "Member not found")
    public ResponseEntity<MemberResponse> updateStatus(@PathVariable Long id,
                                                       @Valid @RequestBody UpdateMemberStatusRequest request) {
        return ResponseEntity.ok(memberService.updateStatus(id, request.status()));
    }
}
