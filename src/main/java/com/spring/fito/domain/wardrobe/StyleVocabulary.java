package com.spring.fito.domain.wardrobe;

import java.util.List;

/**
 * 클라이언트 입력 보조용 정적 어휘
 * - 아이템 태그 추천 목록
 * - 상황(프롬프트) 예시 목록
 */
public final class StyleVocabulary {

    private StyleVocabulary() {
    }

    public static final List<String> SUGGESTED_TAGS = List.of(
        // Style
        "Casual", "Formal", "Business", "Active", "Loungewear", "Party",
        // Season
        "Summer", "Winter", "Spring", "Fall", "All-Season",
        // Colors
        "Black", "White", "Navy", "Gray", "Brown", "Beige", "Red", "Blue", "Green", "Pink", "Orange", "Yellow", "Purple",
        // Patterns
        "Solid", "Striped", "Plaid", "Floral", "Graphic",
        // Material
        "Cotton", "Denim", "Leather", "Wool", "Silk", "Linen",
        // Occasion
        "Work", "Date Night", "Gym", "Beach", "Travel", "Wedding"
    );

    public static final List<String> PROMPT_SUGGESTIONS = List.of(
        "Job interview today",
        "Casual coffee date",
        "Gym workout session",
        "Dinner party tonight",
        "Rainy day walk",
        "Beach day with friends",
        "Working from home",
        "Wedding guest outfit",
        "Winter shopping trip",
        "Summer festival"
    );
}
