package com.spring.fito.domain.enums;

/**
 * 코디 생성 상태 머신 단계
 *
 * IDLE → VALIDATING → (AI_PATH | LOCAL_PATH) → COMPLETED | FAILED
 */
public enum GenerationPhase {
    IDLE,
    VALIDATING,
    AI_PATH,
    LOCAL_PATH,
    COMPLETED,
    FAILED;

    public boolean isInFlight() {
        return this == AI_PATH || this == LOCAL_PATH;
    }
}
