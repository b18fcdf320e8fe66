package com.spring.fito.dto.outfit;

import com.spring.fito.domain.enums.ClothingCategory;
import com.spring.fito.domain.wardrobe.ClothingItem;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * 옷장 아이템 스냅샷 DTO
 */
public record ClothingItemRequest(
    @NotBlank String id,
    @NotNull ClothingCategory category,
    List<String> tags
) {
    public ClothingItem toDomain() {
        return new ClothingItem(id, category, tags);
    }
}
