package com.spring.fito.exception;

import java.time.LocalDateTime;

/**
 * API 에러 응답 표준 포맷
 * - upgradeOffer: true면 클라이언트는 구독 플랜 화면을 띄운다
 */
public record ApiErrorResponse(
    LocalDateTime timestamp,
    int status,
    ErrorCode code,
    String message,
    String path,
    boolean upgradeOffer
) {
    public static ApiErrorResponse of(int status, ErrorCode code, String message, String path) {
        return new ApiErrorResponse(LocalDateTime.now(), status, code, message, path, false);
    }

    public static ApiErrorResponse of(int status, ErrorCode code, String message, String path, boolean upgradeOffer) {
        return new ApiErrorResponse(LocalDateTime.now(), status, code, message, path, upgradeOffer);
    }
}
