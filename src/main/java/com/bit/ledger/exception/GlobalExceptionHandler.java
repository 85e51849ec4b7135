package com.bit.ledger.exception;

import com.bit.ledger.result.Result;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 接口层统一异常处理：ErrorType → HTTP 状态码 + Result
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<Result<Void>> handleLedger(LedgerException ex, HttpServletRequest request) {
        HttpStatus status = statusOf(ex.getErrorType());
        if (status.is5xxServerError()) {
            log.error("{} {} failed: {}", request.getMethod(), request.getRequestURI(), ex.getMessage(), ex);
        } else {
            log.warn("{} {} rejected: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(Result.error(status.value(), ex.getDetail()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            IllegalArgumentException.class})
    public ResponseEntity<Result<Void>> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("{} {} bad request: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return ResponseEntity.badRequest().body(Result.error(Result.SC_BAD_REQUEST_400, ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Result<Void>> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("{} {} unexpected error", request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Result.error(Result.SC_INTERNAL_SERVER_ERROR_500, "Internal server error"));
    }

    static HttpStatus statusOf(ErrorType type) {
        switch (type) {
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case CONFLICT:
            case INTEGRITY_FAILURE:
                return HttpStatus.CONFLICT;
            case INPUT_ERROR:
                return HttpStatus.BAD_REQUEST;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
