package com.library.lending.controller.handler;

import com.library.lending.dto.response.ErrorResponse;
import com.library.lending.exception.ContentionFailures;
import com.library.lending.exception.ErrorKind;
import com.library.lending.exception.LibraryException;
import jakarta.servlet.http.HttpServletRequest;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.jpa.JpaSystemException;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final Map<String, String> UNIQUE_CONSTRAINT_MESSAGES = Map.of(
        "uk_books_isbn", "ISBN already exists",
        "uk_members_email", "Email already registered",
        "uk_categories_name", "Category already exists"
    );

    private static final String COPY_RANGE_CONSTRAINT = "ck_books_copy_range";

    @ExceptionHandler(LibraryException.class)
    public ResponseEntity<ErrorResponse> handleLibrary(LibraryException ex, HttpServletRequest request) {
        HttpStatus status = statusOf(ex.getKind());
        if (ex.getKind() == ErrorKind.INTERNAL_INCONSISTENCY) {
            log.error("Inventory inconsistency on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        }
        return build(status, ex.getKind(), ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex,
                                                           HttpServletRequest request) {
        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult().getFieldErrors()
            .stream()
            .map(fe -> new ErrorResponse.FieldError(fe.getField(), fe.getDefaultMessage()))
            .toList();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(
            new ErrorResponse(400, "Bad Request", ErrorKind.VALIDATION_ERROR, "Validation failed",
                              Instant.now(), request.getRequestURI(), fieldErrors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex,
                                                           HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION_ERROR, "Malformed request body", request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                             HttpServletRequest request) {
        String msg = String.format("Invalid value '%s' for parameter '%s'", ex.getValue(), ex.getName());
        return build(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION_ERROR, msg, request);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrity(DataIntegrityViolationException ex,
                                                              HttpServletRequest request) {
        String constraintName = extractConstraintName(ex);
        if (constraintName != null && UNIQUE_CONSTRAINT_MESSAGES.containsKey(constraintName)) {
            return build(HttpStatus.CONFLICT, ErrorKind.DUPLICATE_KEY,
                         UNIQUE_CONSTRAINT_MESSAGES.get(constraintName), request);
        }
        if (COPY_RANGE_CONSTRAINT.equals(constraintName)) {
            log.error("Copy counter left its range on {}", request.getRequestURI(), ex);
            return build(HttpStatus.INTERNAL_SERVER_ERROR, ErrorKind.INTERNAL_INCONSISTENCY,
                         "Copy counters would leave their valid range", request);
        }
        return build(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION_ERROR, "Data integrity violation", request);
    }

    @ExceptionHandler({ConcurrencyFailureException.class, QueryTimeoutException.class,
                       TransactionTimedOutException.class})
    public ResponseEntity<ErrorResponse> handleBusy(RuntimeException ex, HttpServletRequest request) {
        log.warn("Contention on {}: {}", request.getRequestURI(), ex.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, ErrorKind.BUSY,
                     "Resource is busy. Please retry.", request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex,
                                                                HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION_ERROR, ex.getMessage(), request);
    }

    /** Expired transaction deadlines arrive here wrapped in a system exception. */
    @ExceptionHandler({JpaSystemException.class, TransactionSystemException.class})
    public ResponseEntity<ErrorResponse> handleSystem(RuntimeException ex, HttpServletRequest request) {
        if (ContentionFailures.isContention(ex)) {
            return handleBusy(ex, request);
        }
        return handleGeneral(ex, request);
    }

    /** Anything unclassified is reported as {@code INTERNAL_INCONSISTENCY} with a generic message. */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneral(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ErrorKind.INTERNAL_INCONSISTENCY,
                     "An unexpected error occurred", request);
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION_ERROR -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case DUPLICATE_KEY, MEMBER_INACTIVE, NO_COPIES_AVAILABLE, ALREADY_RETURNED -> HttpStatus.CONFLICT;
            case BUSY -> HttpStatus.SERVICE_UNAVAILABLE;
            case INTERNAL_INCONSISTENCY -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, ErrorKind kind, String message,
                                                HttpServletRequest request) {
        return ResponseEntity.status(status).body(
            new ErrorResponse(status.value(), status.getReasonPhrase(), kind, message,
                              Instant.now(), request.getRequestURI()));
    }

    private String extractConstraintName(DataIntegrityViolationException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof ConstraintViolationException cve && cve.getConstraintName() != null) {
            return cve.getConstraintName().toLowerCase();
        }
        return null;
    }
}
