package com.lendrisk.config;

import com.lendrisk.exception.ErrorCode;
import com.lendrisk.exception.LendingException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(LendingException.class)
    public ResponseEntity<Map<String, Object>> handleLending(LendingException ex, HttpServletRequest req) {
        HttpStatus status = statusFor(ex.getCode());
        return ResponseEntity.status(status).body(body(status, ex.getCode().name(), ex.getMessage(), req));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest req) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return body(HttpStatus.BAD_REQUEST, "VALIDATION", message, req);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadInput(Exception ex, HttpServletRequest req) {
        return body(HttpStatus.BAD_REQUEST, "VALIDATION", ex.getMessage(), req);
    }

    @ExceptionHandler(DataAccessException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleData(DataAccessException ex, HttpServletRequest req) {
        log.error("[api] data access failed on {}: {}", req.getRequestURI(), ex.getMessage());
        String message = ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage();
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "DATABASE", message, req);
    }

    static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
            case UNKNOWN_ASSET, UNKNOWN_LOAN, UNKNOWN_USER -> HttpStatus.NOT_FOUND;
            case UNAUTHORIZED, NOT_LOAN_HOLDER -> HttpStatus.FORBIDDEN;
            case RESOURCE_BUSY, DUPLICATE_ACCOUNT -> HttpStatus.CONFLICT;
            case CUSTODY_FAILURE -> HttpStatus.BAD_GATEWAY;
            default -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
    }

    private static Map<String, Object> body(HttpStatus status, String code, String message, HttpServletRequest req) {
        // LinkedHashMap: message may be null, which Map.of rejects
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("code", code);
        body.put("message", message);
        body.put("path", req.getRequestURI());
        return body;
    }
}
