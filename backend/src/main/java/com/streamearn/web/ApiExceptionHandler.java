package com.streamearn.web;

import com.streamearn.service.InvariantViolationException;
import com.streamearn.service.PoolNotFoundException;
import com.streamearn.service.UnknownContentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(fe ->
                fieldErrors.putIfAbsent(fe.getField(), fe.getDefaultMessage())
        );

        String detail = fieldErrors.isEmpty()
                ? "Validation failed"
                : "Validation failed: " + String.join("; ", fieldErrors.values());

        return ResponseEntity.badRequest()
                .body(new ApiErrorResponse("validation_failed", detail, fieldErrors));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
        if (AuthenticatedIdentity.IDENTITY_HEADER.equals(ex.getHeaderName())) {
            return error(HttpStatus.UNAUTHORIZED, "identity_required", "An authenticated identity is required");
        }
        return error(HttpStatus.BAD_REQUEST, "missing_header", "Missing header " + ex.getHeaderName());
    }

    @ExceptionHandler(UnknownContentException.class)
    public ResponseEntity<ApiErrorResponse> handleUnknownContent(UnknownContentException ex) {
        return error(HttpStatus.NOT_FOUND, "unknown_content", ex.getMessage());
    }

    @ExceptionHandler(PoolNotFoundException.class)
    public ResponseEntity<ApiErrorResponse> handlePoolNotFound(PoolNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "pool_not_found", ex.getMessage());
    }

    @ExceptionHandler(InvariantViolationException.class)
    public ResponseEntity<ApiErrorResponse> handleInvariantViolation(InvariantViolationException ex) {
        log.error("Ledger invariant violated for period {}: {}", ex.getPeriodKey(), ex.getMessage());
        return error(HttpStatus.CONFLICT, "ledger_unbalanced", ex.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiErrorResponse> handleBadRequest(RuntimeException ex) {
        return error(HttpStatus.BAD_REQUEST, "invalid_request", ex.getMessage());
    }

    private static ResponseEntity<ApiErrorResponse> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ApiErrorResponse(code, message, Map.of()));
    }

    public record ApiErrorResponse(
            String code,
            String message,
            Map<String, String> fieldErrors
    ) {
    }
}
