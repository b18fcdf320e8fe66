package com.spring.fito.dto.stylist;

import java.util.List;

/**
 * 입력 보조 어휘 응답 DTO
 *
 * @param keywords 로컬 매칭이 인식하는 프롬프트 키워드 (사전 순서)
 */
public record VocabularyResponse(
    List<String> suggestedTags,
    List<String> promptSuggestions,
    List<String> keywords
) {}
