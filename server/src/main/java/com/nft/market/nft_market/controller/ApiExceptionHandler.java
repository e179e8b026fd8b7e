package com.nft.market.nft_market.controller;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import com.nft.market.nft_market.exception.ErrorCode;
import com.nft.market.nft_market.exception.MarketplaceException;
import com.nft.market.nft_market.external.ExternalCallException;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps failures to JSON bodies of the shape
 * {status, error, message, listingId, orderId, failureKind, ts}.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    private final Clock clock;

    public ApiExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(MarketplaceException.class)
    public ResponseEntity<Map<String, Object>> handleMarketplace(MarketplaceException ex) {
        HttpStatus status = statusFor(ex.getErrorCode());
        if (status.is5xxServerError()) {
            log.warn("Request failed with {}: {}", ex.getErrorCode(), ex.getMessage());
        } else {
            log.debug("Request rejected with {}: {}", ex.getErrorCode(), ex.getMessage());
        }
        Map<String, Object> body = body(status, ex.getErrorCode().name(), ex.getMessage());
        body.put("listingId", ex.getListingId());
        body.put("orderId", ex.getOrderId());
        body.put("failureKind", ex.getCallFailure() != null ? ex.getCallFailure().getKind().name() : null);
        return ResponseEntity.status(status).body(body);
    }

    /**
     * Reverts raised by the sandbox collaborators outside a marketplace request.
     */
    @ExceptionHandler(ExternalCallException.class)
    public ResponseEntity<Map<String, Object>> handleRevert(ExternalCallException ex) {
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "REVERTED", ex.getReason()));
    }

    @ExceptionHandler({ IllegalArgumentException.class, ArithmeticException.class,
            MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .findFirst()
                .orElse("Invalid request");
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", message));
    }

    static HttpStatus statusFor(ErrorCode code) {
        switch (code) {
            case INVALID_LISTING:
            case ITEM_NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case UNAUTHORIZED:
                return HttpStatus.UNAUTHORIZED;
            case ITEM_NO_LONGER_EXISTS:
            case OWNERSHIP_CHANGED:
            case INVALID_ORDER:
                return HttpStatus.CONFLICT;
            default:
                break;
        }
        return switch (code.getCategory()) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case CONSISTENCY -> HttpStatus.CONFLICT;
            case INSUFFICIENCY -> HttpStatus.UNPROCESSABLE_ENTITY;
            case EXTERNAL -> HttpStatus.BAD_GATEWAY;
        };
    }

    private Map<String, Object> body(HttpStatus status, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", error);
        body.put("message", message);
        body.put("ts", Instant.now(clock).toString());
        return body;
    }
}
