package com.spring.fito.external;

import com.spring.fito.domain.outfit.AiSuggestion;
import com.spring.fito.domain.wardrobe.ClothingItem;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 외부 AI 코디 추천 전송 계층
 *
 * 실패 시 future는 다음 중 하나로 완료된다.
 * - UnauthenticatedException: 로그인 필요 (폴백 없음)
 * - QuotaExceededException: 월 한도 소진 (폴백 없음, 업그레이드 안내)
 * - 그 외 예외: 일시적 실패로 간주 → 로컬 매칭 폴백
 */
public interface OutfitSuggestionClient {

    CompletableFuture<AiSuggestion> generateSuggestion(String prompt,
                                                       List<ClothingItem> availableItems,
                                                       String userStyle);

    /** 받은 제안이 최종 결과로 채택되지 않았을 때 호출 (더 최신 요청에 밀린 경우) */
    default void discard(AiSuggestion suggestion) {
    }
}
