package com.freightbid.auction.controller;

import com.freightbid.auction.exception.AuctionClosedException;
import com.freightbid.auction.exception.AuctionException;
import com.freightbid.auction.exception.ConflictException;
import com.freightbid.auction.exception.NotFoundException;
import com.freightbid.auction.exception.ValidationException;
import com.freightbid.shared.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * Maps auction failures to the {@link ApiResponse} error envelope.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(ValidationException ex) {
        return respond(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotFound(NotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler({ConflictException.class, AuctionClosedException.class})
    public ResponseEntity<ApiResponse<Void>> handleConflict(AuctionException ex) {
        return respond(HttpStatus.CONFLICT, ex);
    }

    @ExceptionHandler(AuctionException.class)
    public ResponseEntity<ApiResponse<Void>> handleAuction(AuctionException ex) {
        HttpStatus status = AuctionException.SERVICE_UNAVAILABLE.equals(ex.getCode())
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.BAD_REQUEST;
        return respond(status, ex);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleBeanValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("Request rejected [VALIDATION_FAILED]: {}", message);
        return ResponseEntity.badRequest().body(ApiResponse.error("VALIDATION_FAILED", message));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiResponse<Void>> handleMalformed(Exception ex) {
        log.warn("Request rejected [MALFORMED_REQUEST]: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ApiResponse.error("MALFORMED_REQUEST", "Request could not be parsed"));
    }

    /** Database-level backstops for the lock discipline (version clash, duplicate idempotency key). */
    @ExceptionHandler({ObjectOptimisticLockingFailureException.class, DataIntegrityViolationException.class})
    public ResponseEntity<ApiResponse<Void>> handleConcurrentWrite(Exception ex) {
        log.warn("Concurrent write rejected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ApiResponse.error("CONCURRENT_MODIFICATION", "The resource was modified concurrently, retry with fresh state"));
    }

    private ResponseEntity<ApiResponse<Void>> respond(HttpStatus status, AuctionException ex) {
        log.warn("Auction error [{}]: {}", ex.getCode(), ex.getMessage());
        return ResponseEntity.status(status).body(ApiResponse.error(ex.getCode(), ex.getMessage()));
    }
}
