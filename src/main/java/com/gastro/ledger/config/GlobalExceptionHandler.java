package com.gastro.ledger.config;

import com.gastro.ledger.exception.LedgerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorResponse> handleLedgerException(LedgerException ex, WebRequest request) {
        if (ex.getStatus().is5xxServerError()) {
            log.error("Ledger error: {}", ex.getMessage(), ex);
        } else {
            log.debug("Rejected request {}: {} {}", request.getDescription(false), ex.getErrorCode(),
                    ex.getMessage());
        }
        return build(ex.getStatus(), ex.getMessage(), ex.getErrorCode(), null, request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(MethodArgumentNotValidException ex,
            WebRequest request) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach((error) -> {
            String fieldName = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });
        return build(HttpStatus.BAD_REQUEST, "Validation failed", "VALIDATION_ERROR", errors, request);
    }

    @ExceptionHandler({ HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class })
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(Exception ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Malformed request", "VALIDATION_ERROR", null, request);
    }

    // Lock wait timed out even after the retry
    @ExceptionHandler(PessimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleLockFailure(PessimisticLockingFailureException ex,
            WebRequest request) {
        log.warn("Lock contention on {}: {}", request.getDescription(false), ex.getMessage());
        return build(HttpStatus.CONFLICT, "The resource is busy, please try again", "TRANSIENT_CONFLICT", null,
                request);
    }

    // A unique key taken by a concurrent writer, after the retry
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrityViolation(DataIntegrityViolationException ex,
            WebRequest request) {
        log.warn("Integrity conflict on {}: {}", request.getDescription(false), ex.getMostSpecificCause().getMessage());
        return build(HttpStatus.CONFLICT, "A concurrent change conflicted with this request, please try again",
                "TRANSIENT_CONFLICT", null, request);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(AccessDeniedException ex, WebRequest request) {
        return build(HttpStatus.FORBIDDEN, "Access denied", "ACCESS_DENIED", null, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGlobalException(Exception ex, WebRequest request) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", "INTERNAL_SERVER_ERROR", null,
                request);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String message, String errorCode,
            Map<String, String> errors, WebRequest request) {
        ErrorResponse error = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .errorCode(errorCode)
                .errors(errors)
                .path(request.getDescription(false))
                .build();
        return new ResponseEntity<>(error, status);
    }

    @lombok.Data
    @lombok.Builder
    @lombok.NoArgsConstructor
    @lombok.AllArgsConstructor
    public static class ErrorResponse {
        private LocalDateTime timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCode;
        private Map<String, String> errors;
        private String path;
    }
}
