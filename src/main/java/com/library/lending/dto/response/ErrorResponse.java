package com.library.lending.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.library.lending.exception.ErrorKind;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
    int status,
    String error,
    ErrorKind kind,
    String message,
    Instant timestamp,
    String path,
    List<FieldError> fieldErrors
) {
    public ErrorResponse(int status, String error, ErrorKind kind, String message,
                         Instant timestamp, String path) {
        this(status, error, kind, message, timestamp, path, List.of());
    }

    public record FieldError(String field, String message) {}
}
