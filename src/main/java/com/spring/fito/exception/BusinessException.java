package com.spring.fito.exception;

/**
 * 비즈니스 예외 최상위
 */
public class BusinessException extends RuntimeException {
    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /** 402 응답 시 구독 업그레이드 화면을 띄워야 하는지 여부 */
    public boolean isUpgradeOffer() {
        return errorCode == ErrorCode.QUOTA_EXCEEDED;
    }
}
