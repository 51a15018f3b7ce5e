package com.partsmarket.common.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;
import java.util.stream.Collectors;

/**
 * Renders every failure as an RFC 7807 {@link ProblemDetail}.
 *
 * <p>Besides the standard fields each problem carries a {@code kind} (see {@link ErrorKind})
 * and the {@code code} of the rule that was broken:</p>
 * <pre>
 *   {
 *     "type": "https://partsmarket.com/errors/insufficient_stock",
 *     "status": 400,
 *     "detail": "Insufficient stock for \"Brake pad\". Available: 2, Requested: 5",
 *     "kind": "INSUFFICIENT_STOCK",
 *     "code": "INSUFFICIENT_STOCK"
 *   }
 * </pre>
 *
 * Storage failures never leak driver messages to the client.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /** Domain rule violations; the thrower's message becomes the detail. */
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ProblemDetail> handleBusinessException(BusinessException e) {
        return problem(e.getErrorCode(), e.getMessage());
    }

    /** Bean validation failures, reported as {@code field: message} pairs. */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidation(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return problem(ErrorCode.INVALID_INPUT, detail.isEmpty() ? ErrorCode.INVALID_INPUT.getMessage() : detail);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ProblemDetail> handleMissingHeader(MissingRequestHeaderException e) {
        return problem(ErrorCode.INVALID_INPUT, "Missing required header: " + e.getHeaderName());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleUnreadableBody(HttpMessageNotReadableException e) {
        return problem(ErrorCode.INVALID_INPUT, "Malformed request body");
    }

    // Reached only after the retry policy gave up.
    @ExceptionHandler(ConcurrencyFailureException.class)
    public ResponseEntity<ProblemDetail> handleConcurrencyFailure(ConcurrencyFailureException e) {
        log.warn("Concurrent modification not resolved by retries: {}", e.getMessage());
        return problem(ErrorCode.CONCURRENT_MODIFICATION, ErrorCode.CONCURRENT_MODIFICATION.getMessage());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ProblemDetail> handleDataAccess(DataAccessException e) {
        log.error("Storage failure", e);
        return problem(ErrorCode.INTERNAL_ERROR, ErrorCode.INTERNAL_ERROR.getMessage());
    }

    private ResponseEntity<ProblemDetail> problem(ErrorCode errorCode, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(errorCode.getStatus(), detail);
        problem.setType(URI.create("https://partsmarket.com/errors/" +
                errorCode.name().toLowerCase()));
        problem.setProperty("kind", errorCode.getKind().name());
        problem.setProperty("code", errorCode.name());
        return ResponseEntity.status(errorCode.getStatus()).body(problem);
    }
}
