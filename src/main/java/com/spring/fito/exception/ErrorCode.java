package com.spring.fito.exception;

/**
 * 에러 코드 표준화
 *
 * EMPTY_PROMPT / EMPTY_WARDROBE / QUOTA_EXCEEDED / NOT_AUTHENTICATED 는
 * 코디 생성 상태 머신의 실패 사유로도 그대로 사용된다.
 */
public enum ErrorCode {
    BAD_REQUEST,
    EMPTY_PROMPT,
    EMPTY_WARDROBE,
    QUOTA_EXCEEDED,     // 업그레이드 안내 동반
    NOT_AUTHENTICATED,
    EXTERNAL_API_ERROR,
    INTERNAL_ERROR
}
