package com.spring.fito.security;

import com.spring.fito.domain.enums.SubscriptionTier;

/**
 * 요청자 식별 정보
 *
 * @param owner         JWT subject 또는 "guest:<X-Client-Id>"
 * @param authenticated 로그인 여부 (AI 경로 사용 조건)
 * @param tier          구독 등급 (게스트는 FREE)
 */
public record StylistIdentity(
    String owner,
    boolean authenticated,
    SubscriptionTier tier
) {
    public static final String GUEST_PREFIX = "guest:";

    public static StylistIdentity member(String subject, SubscriptionTier tier) {
        return new StylistIdentity(subject, true, tier == null ? SubscriptionTier.FREE : tier);
    }

    public static StylistIdentity guest(String clientId) {
        return new StylistIdentity(GUEST_PREFIX + clientId, false, SubscriptionTier.FREE);
    }
}
