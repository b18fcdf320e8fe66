package com.spring.fito.service.generation;

import com.spring.fito.domain.outfit.AiSuggestion;
import com.spring.fito.domain.wardrobe.ClothingItem;
import com.spring.fito.exception.QuotaExceededException;
import com.spring.fito.exception.UnauthenticatedException;
import com.spring.fito.external.OutfitSuggestionClient;
import com.spring.fito.security.StylistIdentity;
import com.spring.fito.service.quota.UsageQuotaService;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 세션별 AI 호출 관문
 *
 * 로그인 확인 → 쿼터 1회분 선점 → 전송 계층 호출
 * 앞의 두 검사 실패는 폴백 없이 종료되는 예외로 future를 완료한다.
 * 호출이 실패하거나 결과가 버려지면(discard) 선점한 1회분을 돌려준다.
 */
@Slf4j
public class AiStylistGateway implements OutfitSuggestionClient {

    private final OutfitSuggestionClient transport;
    private final UsageQuotaService quotaService;
    private volatile StylistIdentity identity;

    public AiStylistGateway(StylistIdentity identity,
                            OutfitSuggestionClient transport,
                            UsageQuotaService quotaService) {
        this.identity = identity;
        this.transport = transport;
        this.quotaService = quotaService;
    }

    /** 요청마다 최신 등급(JWT claim)으로 갱신 */
    public void bind(StylistIdentity current) {
        this.identity = current;
    }

    public StylistIdentity identity() {
        return identity;
    }

    @Override
    public CompletableFuture<AiSuggestion> generateSuggestion(String prompt,
                                                              List<ClothingItem> availableItems,
                                                              String userStyle) {
        StylistIdentity caller = this.identity;

        if (caller == null || !caller.authenticated()) {
            return CompletableFuture.failedFuture(
                new UnauthenticatedException(GenerationMessages.NOT_AUTHENTICATED));
        }
        if (!quotaService.tryReserve(caller)) {
            log.info("[QUOTA] Monthly limit reached: owner={}", caller.owner());
            return CompletableFuture.failedFuture(
                new QuotaExceededException(GenerationMessages.MONTHLY_LIMIT_REACHED));
        }

        CompletableFuture<AiSuggestion> call;
        try {
            call = transport.generateSuggestion(prompt, availableItems, userStyle);
        } catch (RuntimeException e) {
            quotaService.release(caller);
            throw e;
        }
        return call.whenComplete((suggestion, error) -> {
            if (error != null) {
                quotaService.release(caller);
            }
        });
    }

    @Override
    public void discard(AiSuggestion suggestion) {
        StylistIdentity caller = this.identity;
        log.debug("[QUOTA] Discarded AI result, releasing reservation: owner={}", caller.owner());
        quotaService.release(caller);
    }
}
