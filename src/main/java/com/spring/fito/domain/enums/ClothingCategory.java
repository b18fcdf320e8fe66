package com.spring.fito.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 옷장 아이템 카테고리
 *
 * JSON 표기는 표시명("Top")이며, 파싱은 대소문자를 구분하지 않는다 ("top", "TOP" 모두 허용).
 * ACCESSORY는 코디 조합 대상에서 제외된다.
 */
public enum ClothingCategory {
    TOP("Top"),
    BOTTOM("Bottom"),
    SHOES("Shoes"),
    OUTERWEAR("Outerwear"),
    ACCESSORY("Accessory");

    private final String displayName;

    ClothingCategory(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    @JsonCreator
    public static ClothingCategory from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Clothing category is required");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (ClothingCategory category : values()) {
            if (category.name().equals(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown clothing category: " + raw);
    }
}
