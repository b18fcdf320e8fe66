package com.spring.fito.domain.enums;

import java.util.Locale;

/**
 * 구독 등급
 * - FREE: 월 생성 횟수 제한
 * - PREMIUM: 무제한
 */
public enum SubscriptionTier {
    FREE,
    PREMIUM;

    public static SubscriptionTier fromClaim(Object claim) {
        if (claim == null) return FREE;
        return "PREMIUM".equals(claim.toString().trim().toUpperCase(Locale.ROOT)) ? PREMIUM : FREE;
    }
}
