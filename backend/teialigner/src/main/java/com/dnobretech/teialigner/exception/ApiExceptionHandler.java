package com.dnobretech.teialigner.exception;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    // 400 - XML is not well-formed
    @ExceptionHandler(TeiParseException.class)
    public ResponseEntity<ApiError> handleParse(TeiParseException ex, HttpServletRequest req) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), req);
    }

    // 400 - nothing alignable on one side
    @ExceptionHandler(DegenerateInputException.class)
    public ResponseEntity<ApiError> handleDegenerate(DegenerateInputException ex, HttpServletRequest req) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), req);
    }

    // 400 - unsupported language and other bad arguments
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleBadRequest(IllegalArgumentException ex, HttpServletRequest req) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), req);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest req) {
        return error(HttpStatus.BAD_REQUEST, "Malformed request body", req);
    }

    // 400 - @Valid on the request body
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationError> handleBodyValidation(MethodArgumentNotValidException ex, HttpServletRequest req) {
        var errs = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> new ValidationError.FieldErr(fe.getField(), fe.getDefaultMessage()))
                .toList();
        return ResponseEntity.badRequest().body(
                new ValidationError(400, "Bad Request", errs, req.getRequestURI(), Instant.now())
        );
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(ConstraintViolationException ex, HttpServletRequest req) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), req);
    }

    // 503 - admission control
    @ExceptionHandler(AlignmentBusyException.class)
    public ResponseEntity<ApiError> handleBusy(AlignmentBusyException ex, HttpServletRequest req) {
        log.warn("[tei-align] rejected {}: {}", req.getRequestURI(), ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), req);
    }

    // 500 - aligner failure
    @ExceptionHandler(AlignmentException.class)
    public ResponseEntity<ApiError> handleAlignment(AlignmentException ex, HttpServletRequest req) {
        log.error("[tei-align] alignment failed", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "TEI alignment failed: " + ex.getMessage(), req);
    }

    // 500 - invariant violation, never a user error
    @ExceptionHandler(IdentifierCollisionException.class)
    public ResponseEntity<ApiError> handleCollision(IdentifierCollisionException ex, HttpServletRequest req) {
        log.error("[tei-align] identifier invariant violated", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal identifier conflict", req);
    }

    // 500 - fallback
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest req) {
        log.error("Unhandled error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), req);
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String message, HttpServletRequest req) {
        return ResponseEntity.status(status).body(
                new ApiError(status.value(), status.getReasonPhrase(), message, req.getRequestURI(), Instant.now())
        );
    }
}
