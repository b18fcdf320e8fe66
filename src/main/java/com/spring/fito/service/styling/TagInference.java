package com.spring.fito.service.styling;

import java.util.List;
import java.util.Set;

/**
 * 프롬프트에서 추론한 키워드/스타일 태그
 *
 * @param matchedKeywords 사전(테이블) 삽입 순서대로 정렬된 매칭 키워드
 * @param tags            매칭 키워드들의 태그 합집합
 */
public record TagInference(List<String> matchedKeywords, Set<String> tags) {

    public TagInference {
        matchedKeywords = List.copyOf(matchedKeywords);
        tags = Set.copyOf(tags);
    }

    public static TagInference none() {
        return new TagInference(List.of(), Set.of());
    }
}
