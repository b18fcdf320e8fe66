package com.spring.fito.service.styling;

import com.spring.fito.domain.wardrobe.ClothingItem;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.random.RandomGenerator;

/**
 * 슬롯(카테고리) 하나에 대한 최적 아이템 선택기
 *
 * - 후보가 없으면 empty
 * - 원하는 태그가 없거나 아무 후보도 태그가 겹치지 않으면 후보 중 무작위 1개
 * - 그 외에는 |item.tags ∩ desiredTags| 최대 점수 동점자 중 무작위 1개 (같은 프롬프트라도 매번 다른 코디)
 */
@Component
public class CategoryMatcher {

    private final RandomGenerator random;

    public CategoryMatcher(@Qualifier("stylistRandom") RandomGenerator random) {
        this.random = random;
    }

    public Optional<ClothingItem> bestMatch(List<ClothingItem> candidates, Set<String> desiredTags) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        ScoredCandidates best = tiedBest(candidates, desiredTags);
        if (best.score() > 0) {
            return Optional.of(pick(best.items()));
        }
        return Optional.of(pick(candidates));
    }

    /**
     * 최고 점수와 동점 후보 목록 (무작위성 없음)
     */
    public ScoredCandidates tiedBest(List<ClothingItem> candidates, Set<String> desiredTags) {
        if (candidates == null || candidates.isEmpty() || desiredTags == null || desiredTags.isEmpty()) {
            return new ScoredCandidates(0, List.of());
        }

        int maxScore = 0;
        List<ClothingItem> tied = new ArrayList<>();
        for (ClothingItem item : candidates) {
            int score = score(item, desiredTags);
            if (score > maxScore) {
                maxScore = score;
                tied.clear();
                tied.add(item);
            } else if (score == maxScore && score > 0) {
                tied.add(item);
            }
        }
        return new ScoredCandidates(maxScore, tied);
    }

    static int score(ClothingItem item, Set<String> desiredTags) {
        Set<String> itemTags = new HashSet<>(item.tags());
        itemTags.retainAll(desiredTags);
        return itemTags.size();
    }

    private ClothingItem pick(List<ClothingItem> items) {
        return items.get(random.nextInt(items.size()));
    }

    public record ScoredCandidates(int score, List<ClothingItem> items) {
        public ScoredCandidates {
            items = List.copyOf(items);
        }
    }
}
