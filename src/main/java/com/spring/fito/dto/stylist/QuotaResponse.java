package com.spring.fito.dto.stylist;

import com.spring.fito.domain.enums.SubscriptionTier;
import com.spring.fito.service.quota.QuotaStatus;

/**
 * 월간 생성 한도 응답 DTO
 * - 무제한이면 monthlyLimit / requestsRemaining 은 null
 */
public record QuotaResponse(
    SubscriptionTier tier,
    Integer monthlyLimit,
    int used,
    Integer requestsRemaining,
    boolean unlimited
) {
    public static QuotaResponse from(QuotaStatus status) {
        if (status.hasUnlimitedEntitlement()) {
            return new QuotaResponse(status.tier(), null, status.used(), null, true);
        }
        return new QuotaResponse(status.tier(), status.monthlyLimit(), status.used(), status.requestsRemaining(), false);
    }
}
