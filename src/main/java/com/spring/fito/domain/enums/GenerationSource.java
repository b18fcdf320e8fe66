package com.spring.fito.domain.enums;

/**
 * 결과를 만든 경로
 */
public enum GenerationSource {
    AI,
    LOCAL,
    NONE
}
