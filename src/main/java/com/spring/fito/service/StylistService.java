package com.spring.fito.service;

import com.spring.fito.config.StylistProperties;
import com.spring.fito.domain.enums.GenerationStatus;
import com.spring.fito.domain.wardrobe.StyleVocabulary;
import com.spring.fito.dto.outfit.GenerateOutfitRequest;
import com.spring.fito.dto.outfit.GenerateOutfitResponse;
import com.spring.fito.dto.outfit.GenerationStatusResponse;
import com.spring.fito.dto.stylist.QuotaResponse;
import com.spring.fito.dto.stylist.StyleAdviceResponse;
import com.spring.fito.dto.stylist.VocabularyResponse;
import com.spring.fito.exception.BadRequestException;
import com.spring.fito.exception.BusinessException;
import com.spring.fito.exception.ErrorCode;
import com.spring.fito.exception.QuotaExceededException;
import com.spring.fito.exception.UnauthenticatedException;
import com.spring.fito.security.StylistIdentity;
import com.spring.fito.service.generation.GenerationRequest;
import com.spring.fito.service.generation.GenerationResult;
import com.spring.fito.service.generation.GenerationSnapshot;
import com.spring.fito.service.generation.OutfitGenerationOrchestrator;
import com.spring.fito.service.generation.StylistSessionRegistry;
import com.spring.fito.service.quota.QuotaStatus;
import com.spring.fito.service.quota.UsageQuotaService;
import com.spring.fito.service.styling.StyleNoteCatalog;
import com.spring.fito.service.styling.TagLexicon;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 컨트롤러용 코디 서비스
 *
 * 세션 조회 → 쿼터/AI 가능 여부 계산 → 오케스트레이터 실행 → 응답 변환
 * FAILED 결과는 BusinessException으로 바꿔 GlobalExceptionHandler가 상태 코드를 결정하게 한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StylistService {

    private final StylistSessionRegistry sessionRegistry;
    private final UsageQuotaService usageQuotaService;
    private final StyleNoteCatalog styleNoteCatalog;
    private final TagLexicon tagLexicon;
    private final StylistProperties props;

    public CompletableFuture<GenerateOutfitResponse> generate(StylistIdentity identity, GenerateOutfitRequest request) {
        OutfitGenerationOrchestrator session = sessionRegistry.sessionFor(identity);

        boolean aiAvailable = identity.authenticated() && props.aiEnabled();
        GenerationRequest generation = new GenerationRequest(
            request.prompt(),
            request.wardrobeItems(),
            aiAvailable,
            usageQuotaService.statusOf(identity)
        );

        log.info("[GEN] owner={} ai={} items={}", identity.owner(), aiAvailable, generation.wardrobe().size());

        return session.generate(generation).thenApply(StylistService::toResponse);
    }

    public GenerationStatusResponse status(StylistIdentity identity) {
        GenerationSnapshot snapshot = sessionRegistry.find(identity.owner())
            .map(OutfitGenerationOrchestrator::snapshot)
            .orElseGet(GenerationSnapshot::idle);
        return GenerationStatusResponse.from(snapshot);
    }

    public void reset(StylistIdentity identity) {
        sessionRegistry.find(identity.owner()).ifPresent(OutfitGenerationOrchestrator::reset);
    }

    public QuotaResponse quota(StylistIdentity identity) {
        QuotaStatus status = usageQuotaService.statusOf(identity);
        if (status == null) {
            throw new UnauthenticatedException("Please sign in to use AI styling");
        }
        return QuotaResponse.from(status);
    }

    public VocabularyResponse vocabulary() {
        return new VocabularyResponse(
            StyleVocabulary.SUGGESTED_TAGS,
            StyleVocabulary.PROMPT_SUGGESTIONS,
            List.copyOf(tagLexicon.keywordTags().keySet())
        );
    }

    public StyleAdviceResponse advice(String occasion) {
        if (occasion == null || occasion.isBlank()) {
            throw new BadRequestException("occasion is required");
        }
        return new StyleAdviceResponse(occasion, styleNoteCatalog.adviceFor(occasion));
    }

    static GenerateOutfitResponse toResponse(GenerationResult result) {
        if (result.status() == GenerationStatus.FAILED) {
            throw toException(result);
        }
        return GenerateOutfitResponse.from(result);
    }

    private static BusinessException toException(GenerationResult result) {
        ErrorCode code = result.error();
        String message = result.userMessage();
        return switch (code) {
            case EMPTY_PROMPT, EMPTY_WARDROBE -> new BadRequestException(code, message);
            case QUOTA_EXCEEDED -> new QuotaExceededException(message);
            case NOT_AUTHENTICATED -> new UnauthenticatedException(message);
            default -> new BusinessException(code, message);
        };
    }
}
