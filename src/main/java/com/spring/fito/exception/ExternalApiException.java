package com.spring.fito.exception;

/**
 * 외부 AI 호출 실패
 * - 코디 생성 경로에서는 사용자에게 노출되지 않고 로컬 매칭으로 폴백된다
 */
public class ExternalApiException extends BusinessException {
    public ExternalApiException(String message) {
        super(ErrorCode.EXTERNAL_API_ERROR, message);
    }

    public ExternalApiException(String message, Throwable cause) {
        super(ErrorCode.EXTERNAL_API_ERROR, message, cause);
    }
}
