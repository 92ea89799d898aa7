package com.library.lending.controller;

import com.library.lending.dto.request.CreateAuthorRequest;
import com.library.lending.dto.response.AuthorResponse;
import com.library.lending.dto.response.ListResponse;
import com.library.lending.service.AuthorService;
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
@RequestMapping("/api/v1/authors")
@RequiredArgsConstructor
@Tag(name = "Authors", description = "Author registry")
public class AuthorController {

    private final AuthorService authorService;

    @GetMapping
    @Operation(summary = "List all authors", description = "Ordered by last name, then first name, with book counts.")
    public ResponseEntity<ListResponse<AuthorResponse>> findAll() {
        return ResponseEntity.ok(ListResponse.of(authorService.findAll()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get author by ID")
    @ApiResponse(responseCode = "200", description = "Author found")
    @ApiResponse(responseCode = "404", description = "Author not found")
    public ResponseEntity<AuthorResponse> findById(@PathVariable Long id) {
        return ResponseEntity.ok(authorService.findById(id));
    }

    @PostMapping
    @Operation(summary = "Create a new author")
    @ApiResponse(responseCode = "201", description = "Author created")
    @ApiResponse(responseCode = "400", description = "Validation error")
    public ResponseEntity<AuthorResponse> create(@Valid @RequestBody CreateAuthorRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authorService.create(request));
    }
}
