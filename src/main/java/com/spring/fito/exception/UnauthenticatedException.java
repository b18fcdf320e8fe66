package com.spring.fito.exception;

/**
 * 로그인하지 않은 사용자가 AI 스타일링을 요청한 경우
 */
public class UnauthenticatedException extends BusinessException {
    public UnauthenticatedException(String message) {
        super(ErrorCode.NOT_AUTHENTICATED, message);
    }
}
