package com.spring.fito.domain.wardrobe;

import com.spring.fito.domain.enums.ClothingCategory;

import java.util.List;
import java.util.Objects;

/**
 * 옷장 아이템 (읽기 전용 스냅샷)
 * - 저장/이미지 처리는 클라이언트 소관이며, 서버는 요청마다 전달받은 스냅샷만 사용한다
 */
public record ClothingItem(
    String id,
    ClothingCategory category,
    List<String> tags
) {
    public ClothingItem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(category, "category");
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static ClothingItem of(String id, ClothingCategory category, String... tags) {
        return new ClothingItem(id, category, List.of(tags));
    }
}
