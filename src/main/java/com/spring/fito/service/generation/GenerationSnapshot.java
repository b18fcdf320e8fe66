package com.spring.fito.service.generation;

import com.spring.fito.domain.enums.GenerationPhase;
import com.spring.fito.domain.enums.GenerationStatus;
import com.spring.fito.domain.outfit.GeneratedOutfit;
import com.spring.fito.exception.ErrorCode;

/**
 * 세션의 관측 가능한 상태 (불변 스냅샷)
 */
public record GenerationSnapshot(
    GenerationPhase phase,
    boolean generating,
    String statusMessage,
    GeneratedOutfit lastOutfit,
    String lastReasoning,
    String lastStyleTip,
    ErrorCode lastError,
    String lastErrorMessage,
    boolean upgradeOfferPending,
    long lastGenerationId
) {
    public static GenerationSnapshot idle() {
        return new GenerationSnapshot(GenerationPhase.IDLE, false, null, null, null, null, null, null, false, 0L);
    }

    /** 새 요청 시작: 이전 결과 문구/에러는 지우고 마지막 코디는 유지 */
    GenerationSnapshot begin(long generationId) {
        return new GenerationSnapshot(GenerationPhase.VALIDATING, false, null, lastOutfit,
            null, null, null, null, false, generationId);
    }

    GenerationSnapshot enter(GenerationPhase next, String message) {
        return new GenerationSnapshot(next, next.isInFlight(), message, lastOutfit,
            lastReasoning, lastStyleTip, lastError, lastErrorMessage, upgradeOfferPending, lastGenerationId);
    }

    GenerationSnapshot withStatusMessage(String message) {
        return new GenerationSnapshot(phase, generating, message, lastOutfit,
            lastReasoning, lastStyleTip, lastError, lastErrorMessage, upgradeOfferPending, lastGenerationId);
    }

    GenerationSnapshot finish(GenerationResult result) {
        if (result.status() == GenerationStatus.FAILED) {
            return new GenerationSnapshot(GenerationPhase.FAILED, false, null, lastOutfit,
                null, null, result.error(), result.userMessage(), result.upgradeOfferRequired(), lastGenerationId);
        }
        return new GenerationSnapshot(GenerationPhase.COMPLETED, false, null, result.outfit(),
            result.reasoning(), result.styleTip(), null, null, false, lastGenerationId);
    }
}
