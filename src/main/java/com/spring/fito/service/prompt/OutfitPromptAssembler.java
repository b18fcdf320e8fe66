package com.spring.fito.service.prompt;

import com.spring.fito.domain.enums.ClothingCategory;
import com.spring.fito.domain.wardrobe.ClothingItem;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * 스타일리스트 프롬프트 조립기
 * - 카테고리별(TOPS/BOTTOMS/SHOES/OUTERWEAR)로 아이템 ID + 태그 나열
 * - JSON 전용 응답 형식 지시
 */
@Component
public class OutfitPromptAssembler {

    public static final String SYSTEM_PROMPT =
        "You are a professional fashion stylist, named FITO. You always answer with a single JSON object and nothing else.";

    public String assembleUserPrompt(String occasion, List<ClothingItem> items, String userStyle) {
        String styleLine = (userStyle == null || userStyle.isBlank())
            ? ""
            : "\nThe user describes their personal style as: \"" + userStyle.trim() + "\"\n";

        return """
                Select the best outfit for: "%s"
                %s
                AVAILABLE ITEMS (select ONE from each category that has items):

                TOPS:
                %s

                BOTTOMS:
                %s

                SHOES:
                %s

                OUTERWEAR:
                %s

                Select items that work well together for the occasion. If a category has no suitable items or is empty, set that ID to null.

                Respond ONLY with valid JSON (no markdown):
                {
                  "top_id": "selected-top-id-or-null",
                  "bottom_id": "selected-bottom-id-or-null",
                  "shoes_id": "selected-shoes-id-or-null",
                  "outerwear_id": "selected-outerwear-id-or-null-if-not-needed",
                  "reasoning": "Brief explanation of why these items work together for the occasion",
                  "style_tip": "One helpful styling tip for wearing this outfit"
                }
                """.formatted(
            occasion,
            styleLine,
            section(items, ClothingCategory.TOP),
            section(items, ClothingCategory.BOTTOM),
            section(items, ClothingCategory.SHOES),
            section(items, ClothingCategory.OUTERWEAR)
        );
    }

    private static String section(List<ClothingItem> items, ClothingCategory category) {
        List<ClothingItem> inCategory = items.stream()
            .filter(item -> item.category() == category)
            .toList();
        if (inCategory.isEmpty()) {
            return "  (none available)";
        }
        return IntStream.range(0, inCategory.size())
            .mapToObj(i -> "  %d. ID: \"%s\" - Tags: [%s]".formatted(
                i + 1, inCategory.get(i).id(), tags(inCategory.get(i))))
            .collect(Collectors.joining("\n"));
    }

    private static String tags(ClothingItem item) {
        return item.tags().isEmpty() ? "none" : String.join(", ", item.tags());
    }
}
