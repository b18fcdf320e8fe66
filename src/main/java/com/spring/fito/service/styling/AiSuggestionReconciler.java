package com.spring.fito.service.styling;

import com.spring.fito.domain.enums.ClothingCategory;
import com.spring.fito.domain.outfit.AiSuggestion;
import com.spring.fito.domain.outfit.GeneratedOutfit;
import com.spring.fito.domain.wardrobe.ClothingItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AI가 고른 아이템 ID를 실제 옷장 아이템으로 되돌린다.
 *
 * - ID 순서대로 처리하며, 슬롯별로 처음 해석된 아이템이 자리를 차지한다
 * - 액세서리 / 옷장에 없는 ID는 조용히 버린다
 * - AI 경로이므로 matchedKeywords는 항상 비어 있다
 */
@Slf4j
@Component
public class AiSuggestionReconciler {

    public GeneratedOutfit reconcile(AiSuggestion suggestion, List<ClothingItem> wardrobe) {
        if (suggestion == null || wardrobe == null || wardrobe.isEmpty()) {
            return GeneratedOutfit.empty();
        }

        Map<String, ClothingItem> byId = new LinkedHashMap<>();
        for (ClothingItem item : wardrobe) {
            byId.putIfAbsent(item.id(), item);
        }

        Map<ClothingCategory, ClothingItem> slots = new EnumMap<>(ClothingCategory.class);
        int dropped = 0;
        for (String id : suggestion.selectedItemIds()) {
            ClothingItem item = id == null ? null : byId.get(id);
            if (item == null || item.category() == ClothingCategory.ACCESSORY) {
                dropped++;
                continue;
            }
            slots.putIfAbsent(item.category(), item);
        }

        if (dropped > 0) {
            log.debug("[AI] Dropped {} suggested id(s) that did not resolve to an outfit slot", dropped);
        }

        return new GeneratedOutfit(
            slots.get(ClothingCategory.TOP),
            slots.get(ClothingCategory.BOTTOM),
            slots.get(ClothingCategory.SHOES),
            slots.get(ClothingCategory.OUTERWEAR),
            List.of()
        );
    }
}
