package com.spring.fito.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * JWT 검증 설정
 *
 * @param secret    Base64 인코딩된 HS256 키
 * @param tierClaim 구독 등급이 담긴 claim 이름
 */
@ConfigurationProperties(prefix = "auth.jwt")
public record JwtProperties(
    String secret,
    String tierClaim
) {
    public JwtProperties {
        if (tierClaim == null || tierClaim.isBlank()) {
            tierClaim = "tier";
        }
    }
}
