package com.spring.fito.domain.enums;

/**
 * 코디 생성 시도 1회의 최종 결과
 */
public enum GenerationStatus {
    SUCCESS,            // Completed(success)
    NOTHING_SUITABLE,   // 빈 결과로 완료, 에러가 아님
    FAILED,
    SUPERSEDED          // 더 최신 요청에 밀려 결과가 버려짐
}
