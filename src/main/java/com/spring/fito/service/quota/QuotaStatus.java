package com.spring.fito.service.quota;

import com.spring.fito.domain.enums.SubscriptionTier;

/**
 * 월간 생성 한도 현황
 * - PREMIUM은 monthlyLimit / requestsRemaining 모두 -1 (무제한)
 */
public record QuotaStatus(
    SubscriptionTier tier,
    int monthlyLimit,
    int used,
    int requestsRemaining,
    boolean hasUnlimitedEntitlement
) {
    public static final int UNLIMITED = -1;

    public static QuotaStatus unlimited(int used) {
        return new QuotaStatus(SubscriptionTier.PREMIUM, UNLIMITED, used, UNLIMITED, true);
    }

    public static QuotaStatus limited(int limit, int used) {
        return new QuotaStatus(SubscriptionTier.FREE, limit, used, Math.max(0, limit - used), false);
    }

    /** 생성 요청을 거절해야 하는지 */
    public boolean isExhausted() {
        return requestsRemaining <= 0 && !hasUnlimitedEntitlement;
    }
}
