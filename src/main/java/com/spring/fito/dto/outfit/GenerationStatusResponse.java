package com.spring.fito.dto.outfit;

import com.spring.fito.domain.enums.GenerationPhase;
import com.spring.fito.domain.outfit.GeneratedOutfit;
import com.spring.fito.exception.ErrorCode;
import com.spring.fito.service.generation.GenerationSnapshot;

/**
 * 세션 상태 조회 응답 DTO
 */
public record GenerationStatusResponse(
    GenerationPhase phase,
    boolean generating,
    String statusMessage,
    GeneratedOutfit lastOutfit,
    String lastReasoning,
    String lastStyleTip,
    ErrorCode lastError,
    String errorMessage,
    boolean upgradeOffer,
    long generationId
) {
    public static GenerationStatusResponse from(GenerationSnapshot snapshot) {
        return new GenerationStatusResponse(
            snapshot.phase(),
            snapshot.generating(),
            snapshot.statusMessage(),
            snapshot.lastOutfit(),
            snapshot.lastReasoning(),
            snapshot.lastStyleTip(),
            snapshot.lastError(),
            snapshot.lastErrorMessage(),
            snapshot.upgradeOfferPending(),
            snapshot.lastGenerationId()
        );
    }
}
