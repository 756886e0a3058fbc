package com.demo.lending.config;

import com.demo.lending.exception.LedgerUnavailableException;
import com.demo.lending.exception.LendingException;
import com.demo.lending.exception.SettlementTimeoutException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(LendingException.class)
    public ResponseEntity<Map<String, Object>> handleLending(LendingException ex, HttpServletRequest req) {
        HttpStatus status = statusOf(ex.getReason());
        log.debug("{} {} rejected: {} {}", req.getMethod(), req.getRequestURI(), ex.getReason(), ex.getMessage());
        return body(status, ex.getReason().name(), ex.getMessage(), req);
    }

    @ExceptionHandler(LedgerUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleLedger(LedgerUnavailableException ex, HttpServletRequest req) {
        return body(HttpStatus.SERVICE_UNAVAILABLE, "LEDGER_UNAVAILABLE", ex.getMessage(), req);
    }

    @ExceptionHandler(SettlementTimeoutException.class)
    public ResponseEntity<Map<String, Object>> handleTimeout(SettlementTimeoutException ex, HttpServletRequest req) {
        return body(HttpStatus.GATEWAY_TIMEOUT, "SETTLEMENT_TIMEOUT", ex.getMessage(), req);
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleValidation(Exception ex, HttpServletRequest req) {
        return body(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", ex.getMessage(), req);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleStatus(ResponseStatusException ex, HttpServletRequest req) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        return body(status, status.name(), ex.getReason(), req);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> handleSql(DataAccessException ex, HttpServletRequest req) {
        log.error("Database error on {} {}", req.getMethod(), req.getRequestURI(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "DATABASE_ERROR",
                ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage(), req);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleAny(Exception ex, HttpServletRequest req) {
        log.error("Unhandled error on {} {}", req.getMethod(), req.getRequestURI(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", ex.getMessage(), req);
    }

    static HttpStatus statusOf(LendingException.Reason reason) {
        switch (reason) {
            case LOAN_NOT_FOUND:
            case UNKNOWN_TOKEN:
                return HttpStatus.NOT_FOUND;
            case INVALID_AMOUNT:
            case INVALID_REQUEST:
                return HttpStatus.BAD_REQUEST;
            case NOT_BORROWER:
            case NOT_A_LENDER:
            case BORROWER_CANNOT_LEND:
                return HttpStatus.FORBIDDEN;
            case EXCEEDS_REMAINING:
            case BELOW_MIN_CONTRIBUTION:
            case AMOUNT_MISMATCH:
            case INSUFFICIENT_COLLATERAL:
            case INSUFFICIENT_BALANCE:
            case INSUFFICIENT_ALLOWANCE:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case STALE_QUOTE:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.CONFLICT;
        }
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String reason, String message,
                                                            HttpServletRequest req) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("reason", reason);
        body.put("message", message);
        body.put("path", req.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }
}
