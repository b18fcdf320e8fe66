package com.spring.fito.dto.outfit;

import com.spring.fito.domain.wardrobe.ClothingItem;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * 코디 생성 요청 DTO
 * - 빈 프롬프트 / 빈 옷장은 생성 상태 머신이 EMPTY_PROMPT / EMPTY_WARDROBE로 거절한다
 */
public record GenerateOutfitRequest(
    @Size(max = 500) String prompt,
    List<@Valid ClothingItemRequest> wardrobe
) {
    public List<ClothingItem> wardrobeItems() {
        if (wardrobe == null) return List.of();
        return wardrobe.stream().map(ClothingItemRequest::toDomain).toList();
    }
}
