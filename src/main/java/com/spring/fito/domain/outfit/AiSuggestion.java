package com.spring.fito.domain.outfit;

import java.util.List;

/**
 * 외부 AI가 고른 아이템 ID 목록 + 설명
 * - 한 번의 reconcile 호출 동안만 사용되는 일회성 값
 */
public record AiSuggestion(
    List<String> selectedItemIds,
    String reasoning,
    String styleTip
) {
    public AiSuggestion {
        selectedItemIds = selectedItemIds == null ? List.of() : List.copyOf(selectedItemIds);
    }
}
