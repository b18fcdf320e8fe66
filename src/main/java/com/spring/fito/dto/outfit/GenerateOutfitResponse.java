package com.spring.fito.dto.outfit;

import com.spring.fito.domain.enums.GenerationSource;
import com.spring.fito.domain.enums.GenerationStatus;
import com.spring.fito.domain.outfit.GeneratedOutfit;
import com.spring.fito.service.generation.GenerationResult;

/**
 * 코디 생성 응답 DTO
 * - message: NOTHING_SUITABLE 안내 문구 (성공 시 null)
 */
public record GenerateOutfitResponse(
    long generationId,
    GenerationStatus status,
    GenerationSource source,
    GeneratedOutfit outfit,
    String reasoning,
    String styleTip,
    String message
) {
    public static GenerateOutfitResponse from(GenerationResult result) {
        return new GenerateOutfitResponse(
            result.generationId(),
            result.status(),
            result.source(),
            result.outfit(),
            result.reasoning(),
            result.styleTip(),
            result.userMessage()
        );
    }
}
