package com.library.lending.controller;

import com.library.lending.dto.response.HealthResponse;
import com.library.lending.dto.response.LibraryStatsResponse;
import com.library.lending.service.StatisticsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

@RestController
@RequiredArgsConstructor
@Tag(name = "Statistics", description = "Library-wide counts and liveness")
public class StatsController {

    private final StatisticsService statisticsService;
    private final Clock clock;

    @GetMapping("/api/v1/stats")
    @Operation(summary = "Library statistics", description = "Book, author, member and loan counts with copy totals.")
    public ResponseEntity<LibraryStatsResponse> stats() {
        return ResponseEntity.ok(statisticsService.computeStats());
    }

    @GetMapping("/health")
    @Operation(summary = "Liveness check")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(new HealthResponse("healthy", Instant.now(clock)));
    }
}
