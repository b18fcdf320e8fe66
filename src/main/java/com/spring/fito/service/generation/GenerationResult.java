package com.spring.fito.service.generation;

import com.spring.fito.domain.enums.GenerationSource;
import com.spring.fito.domain.enums.GenerationStatus;
import com.spring.fito.domain.outfit.GeneratedOutfit;
import com.spring.fito.exception.ErrorCode;

/**
 * 코디 생성 1회의 최종 결과
 *
 * - SUCCESS / NOTHING_SUITABLE: outfit 존재 (NOTHING_SUITABLE은 isValid == false)
 * - FAILED: error 존재, QUOTA_EXCEEDED면 upgradeOfferRequired
 *   errorMessage가 있으면 ErrorCode 기본 문구 대신 사용
 * - SUPERSEDED: 더 최신 요청이 시작되어 결과를 버림
 */
public record GenerationResult(
    long generationId,
    GenerationStatus status,
    GenerationSource source,
    GeneratedOutfit outfit,
    String reasoning,
    String styleTip,
    ErrorCode error,
    String errorMessage,
    boolean upgradeOfferRequired
) {
    public static GenerationResult completed(long id, GenerationSource source, GeneratedOutfit outfit,
                                             String reasoning, String styleTip) {
        GenerationStatus status = outfit.isValid() ? GenerationStatus.SUCCESS : GenerationStatus.NOTHING_SUITABLE;
        return new GenerationResult(id, status, source, outfit, reasoning, styleTip, null, null, false);
    }

    public static GenerationResult failed(long id, ErrorCode error) {
        return failed(id, error, null);
    }

    public static GenerationResult failed(long id, ErrorCode error, String errorMessage) {
        return new GenerationResult(id, GenerationStatus.FAILED, GenerationSource.NONE, null, null, null,
            error, errorMessage, error == ErrorCode.QUOTA_EXCEEDED);
    }

    public static GenerationResult superseded(long id) {
        return new GenerationResult(id, GenerationStatus.SUPERSEDED, GenerationSource.NONE, null, null, null, null, null, false);
    }

    /** 사용자에게 보여줄 안내 문구 (성공 시 null) */
    public String userMessage() {
        return switch (status) {
            case NOTHING_SUITABLE -> GenerationMessages.NOTHING_SUITABLE;
            case FAILED -> errorMessage != null ? errorMessage : GenerationMessages.forError(error);
            default -> null;
        };
    }
}
