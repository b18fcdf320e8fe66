package com.spring.fito.service.generation;

import com.spring.fito.domain.wardrobe.ClothingItem;
import com.spring.fito.service.quota.QuotaStatus;

import java.util.List;

/**
 * 코디 생성 요청 한 건
 *
 * @param aiAvailable 로그인 + AI 활성화 여부 (false면 바로 로컬 매칭)
 * @param quota       null이면 쿼터 정보 없음 → 허용
 */
public record GenerationRequest(
    String prompt,
    List<ClothingItem> wardrobe,
    boolean aiAvailable,
    QuotaStatus quota
) {
    public GenerationRequest {
        wardrobe = wardrobe == null ? List.of() : List.copyOf(wardrobe);
    }
}
