package com.spring.fito.dto.openai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 스타일리스트 모델이 응답하는 JSON 구조
 * - 해당 카테고리에서 고를 아이템이 없으면 ID는 null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AiOutfitJson(
    @JsonProperty("top_id") String topId,
    @JsonProperty("bottom_id") String bottomId,
    @JsonProperty("shoes_id") String shoesId,
    @JsonProperty("outerwear_id") String outerwearId,
    String reasoning,
    @JsonProperty("style_tip") String styleTip
) {
    /** top / bottom / shoes 중 하나도 고르지 못했으면 "상황에 맞는 옷 없음" */
    public boolean notSuitable() {
        return isBlank(topId) && isBlank(bottomId) && isBlank(shoesId);
    }

    private static boolean isBlank(String id) {
        return id == null || id.isBlank() || "null".equalsIgnoreCase(id);
    }
}
