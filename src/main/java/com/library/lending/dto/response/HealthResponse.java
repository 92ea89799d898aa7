package com.library.lending.dto.response;

import java.time.Instant;

public record HealthResponse(String status, Instant timestamp) {}
