package com.spring.fito.service.styling;

import com.spring.fito.domain.enums.ClothingCategory;
import com.spring.fito.domain.outfit.GeneratedOutfit;
import com.spring.fito.domain.wardrobe.ClothingItem;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 키워드 기반 로컬 코디 조합기 (AI 미사용 경로 / 폴백 경로)
 *
 * 1. TagLexicon으로 프롬프트 → 원하는 태그 추론
 * 2. 옷장을 카테고리별 후보 풀로 분할 (액세서리 제외)
 * 3. top / bottom / shoes는 항상, outerwear는 날씨 트리거가 있을 때만 매칭
 */
@Component
@RequiredArgsConstructor
public class LocalOutfitComposer {

    private final TagLexicon tagLexicon;
    private final CategoryMatcher categoryMatcher;

    public GeneratedOutfit compose(String prompt, List<ClothingItem> wardrobe) {
        TagInference inference = tagLexicon.tagsFor(prompt);
        boolean withOuterwear = tagLexicon.needsOuterwear(prompt);

        Map<ClothingCategory, List<ClothingItem>> pools = partition(wardrobe);

        ClothingItem top = pick(pools, ClothingCategory.TOP, inference);
        ClothingItem bottom = pick(pools, ClothingCategory.BOTTOM, inference);
        ClothingItem shoes = pick(pools, ClothingCategory.SHOES, inference);
        ClothingItem outerwear = withOuterwear ? pick(pools, ClothingCategory.OUTERWEAR, inference) : null;

        return new GeneratedOutfit(top, bottom, shoes, outerwear, inference.matchedKeywords());
    }

    private ClothingItem pick(Map<ClothingCategory, List<ClothingItem>> pools,
                              ClothingCategory slot,
                              TagInference inference) {
        return categoryMatcher.bestMatch(pools.getOrDefault(slot, List.of()), inference.tags())
            .orElse(null);
    }

    private static Map<ClothingCategory, List<ClothingItem>> partition(List<ClothingItem> wardrobe) {
        if (wardrobe == null) {
            return Map.of();
        }
        return wardrobe.stream()
            .filter(item -> item.category() != ClothingCategory.ACCESSORY)
            .collect(Collectors.groupingBy(ClothingItem::category,
                () -> new EnumMap<>(ClothingCategory.class),
                Collectors.toList()));
    }
}
