package com.spring.fito.domain.outfit;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.spring.fito.domain.enums.ClothingCategory;
import com.spring.fito.domain.wardrobe.ClothingItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 코디 생성 결과 (불변)
 *
 * 각 슬롯은 해당 카테고리의 아이템만 참조한다. 생성 시 검증하며 위반 시 IllegalArgumentException.
 * matchedKeywords는 로컬 매칭 경로에서 인식한 키워드이며, AI 경로에서는 항상 비어 있다.
 */
public record GeneratedOutfit(
    ClothingItem top,
    ClothingItem bottom,
    ClothingItem shoes,
    ClothingItem outerwear,
    List<String> matchedKeywords
) {
    public GeneratedOutfit {
        requireSlot(top, ClothingCategory.TOP);
        requireSlot(bottom, ClothingCategory.BOTTOM);
        requireSlot(shoes, ClothingCategory.SHOES);
        requireSlot(outerwear, ClothingCategory.OUTERWEAR);
        matchedKeywords = matchedKeywords == null ? List.of() : List.copyOf(matchedKeywords);
    }

    public static GeneratedOutfit empty() {
        return new GeneratedOutfit(null, null, null, null, List.of());
    }

    /** 슬롯 순서(top, bottom, shoes, outerwear)대로 비어 있지 않은 아이템 */
    @JsonProperty("items")
    public List<ClothingItem> items() {
        List<ClothingItem> items = new ArrayList<>(4);
        if (top != null) items.add(top);
        if (bottom != null) items.add(bottom);
        if (shoes != null) items.add(shoes);
        if (outerwear != null) items.add(outerwear);
        return Collections.unmodifiableList(items);
    }

    /** 아우터만 있는 경우는 유효하지 않다 */
    @JsonProperty("valid")
    public boolean isValid() {
        return top != null || bottom != null || shoes != null;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return items().isEmpty();
    }

    private static void requireSlot(ClothingItem item, ClothingCategory slot) {
        if (item != null && item.category() != slot) {
            throw new IllegalArgumentException(
                "Item " + item.id() + " of category " + item.category() + " cannot fill the " + slot + " slot");
        }
    }
}
