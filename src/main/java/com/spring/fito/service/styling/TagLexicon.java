package com.spring.fito.service.styling;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 프롬프트 키워드 → 스타일 태그 사전
 *
 * - 토큰 분리 없이 부분 문자열 포함 여부로 매칭한다 ("gymnastics" → "gym")
 * - matchedKeywords 순서는 프롬프트가 아니라 테이블 삽입 순서를 따른다 (재현성)
 */
@Component
public class TagLexicon {

    private static final Map<String, List<String>> KEYWORD_TAGS = buildKeywordTags();

    private static final List<String> OUTERWEAR_TRIGGERS = List.of(
        "winter", "cold", "snow", "rain", "rainy", "jacket", "coat", "chilly", "freezing"
    );

    public TagInference tagsFor(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            return TagInference.none();
        }
        String lowered = prompt.toLowerCase(Locale.ROOT);

        List<String> matched = new ArrayList<>();
        Set<String> tags = new LinkedHashSet<>();
        for (Map.Entry<String, List<String>> entry : KEYWORD_TAGS.entrySet()) {
            if (lowered.contains(entry.getKey())) {
                matched.add(entry.getKey());
                tags.addAll(entry.getValue());
            }
        }
        return new TagInference(matched, tags);
    }

    public boolean needsOuterwear(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            return false;
        }
        String lowered = prompt.toLowerCase(Locale.ROOT);
        return OUTERWEAR_TRIGGERS.stream().anyMatch(lowered::contains);
    }

    public Map<String, List<String>> keywordTags() {
        return KEYWORD_TAGS;
    }

    public List<String> outerwearTriggers() {
        return OUTERWEAR_TRIGGERS;
    }

    private static Map<String, List<String>> buildKeywordTags() {
        Map<String, List<String>> m = new LinkedHashMap<>();

        // Activities
        m.put("gym", List.of("Active", "Gym", "Casual"));
        m.put("workout", List.of("Active", "Gym"));
        m.put("exercise", List.of("Active", "Gym"));
        m.put("run", List.of("Active", "Gym"));
        m.put("sport", List.of("Active", "Gym"));

        // Occasions
        m.put("date", List.of("Date Night", "Formal", "Party"));
        m.put("dinner", List.of("Date Night", "Formal", "Party"));
        m.put("interview", List.of("Formal", "Business", "Work"));
        m.put("meeting", List.of("Business", "Work", "Formal"));
        m.put("work", List.of("Work", "Business"));
        m.put("office", List.of("Work", "Business"));
        m.put("wedding", List.of("Wedding", "Formal", "Party"));
        m.put("party", List.of("Party", "Date Night"));
        m.put("club", List.of("Party", "Date Night"));
        m.put("beach", List.of("Beach", "Summer", "Casual"));
        m.put("travel", List.of("Travel", "Casual", "Loungewear"));

        // Seasons / Weather
        m.put("winter", List.of("Winter", "Wool", "Outerwear"));
        m.put("cold", List.of("Winter", "Wool", "Outerwear"));
        m.put("snow", List.of("Winter", "Wool"));
        m.put("summer", List.of("Summer", "Linen", "Cotton"));
        m.put("hot", List.of("Summer", "Linen"));
        m.put("spring", List.of("Spring", "All-Season"));
        m.put("fall", List.of("Fall", "All-Season"));
        m.put("autumn", List.of("Fall", "All-Season"));
        m.put("rain", List.of("All-Season", "Outerwear"));
        m.put("rainy", List.of("All-Season", "Outerwear"));

        // Styles
        m.put("casual", List.of("Casual", "Loungewear"));
        m.put("relaxed", List.of("Casual", "Loungewear"));
        m.put("chill", List.of("Casual", "Loungewear"));
        m.put("formal", List.of("Formal", "Business"));
        m.put("fancy", List.of("Formal", "Party"));
        m.put("elegant", List.of("Formal", "Party"));

        // Colors
        m.put("black", List.of("Black"));
        m.put("white", List.of("White"));
        m.put("blue", List.of("Blue", "Navy"));
        m.put("red", List.of("Red"));
        m.put("green", List.of("Green"));
        m.put("pink", List.of("Pink"));

        return Collections.unmodifiableMap(m);
    }
}
