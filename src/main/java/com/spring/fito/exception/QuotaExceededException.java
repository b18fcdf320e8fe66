package com.spring.fito.exception;

/**
 * 월간 코디 생성 한도 소진 (AI 호출 전 사전 검사 또는 AI 게이트웨이에서 발생)
 */
public class QuotaExceededException extends BusinessException {
    public QuotaExceededException(String message) {
        super(ErrorCode.QUOTA_EXCEEDED, message);
    }
}
