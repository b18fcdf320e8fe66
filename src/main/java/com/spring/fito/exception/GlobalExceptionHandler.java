package com.spring.fito.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.concurrent.CompletionException;

/**
 * 전역 예외 처리기
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ApiErrorResponse> handleBusiness(BusinessException e, HttpServletRequest req) {
        int status = statusOf(e.getErrorCode());

        if (status >= 500) {
            log.warn("⚠️ [API] {} on {}: {}", e.getErrorCode(), req.getRequestURI(), e.getMessage());
        }

        return ResponseEntity.status(status)
            .body(ApiErrorResponse.of(status, e.getErrorCode(), e.getMessage(), req.getRequestURI(), e.isUpgradeOffer()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException e, HttpServletRequest req) {
        String msg = e.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(err -> err.getField() + ": " + err.getDefaultMessage())
            .orElse("Validation error");

        return ResponseEntity.badRequest()
            .body(ApiErrorResponse.of(400, ErrorCode.BAD_REQUEST, msg, req.getRequestURI()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException e, HttpServletRequest req) {
        return ResponseEntity.badRequest()
            .body(ApiErrorResponse.of(400, ErrorCode.BAD_REQUEST, "Malformed request body", req.getRequestURI()));
    }

    /** 비동기 응답(CompletableFuture)에서 던져진 예외 */
    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<ApiErrorResponse> handleAsync(CompletionException e, HttpServletRequest req) {
        if (e.getCause() instanceof BusinessException be) {
            return handleBusiness(be, req);
        }
        return handleUnknown(e, req);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleUnknown(Exception e, HttpServletRequest req) {
        log.error("Unhandled exception occurred: ", e);

        return ResponseEntity.internalServerError()
            .body(ApiErrorResponse.of(500, ErrorCode.INTERNAL_ERROR, "Something went wrong. Please try again.", req.getRequestURI()));
    }

    static int statusOf(ErrorCode code) {
        return switch (code) {
            case BAD_REQUEST, EMPTY_PROMPT, EMPTY_WARDROBE -> 400;
            case NOT_AUTHENTICATED -> 401;
            case QUOTA_EXCEEDED -> 402;
            case EXTERNAL_API_ERROR -> 502;
            default -> 500;
        };
    }
}
