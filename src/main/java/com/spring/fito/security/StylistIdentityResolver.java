package com.spring.fito.security;

import com.spring.fito.config.JwtProperties;
import com.spring.fito.domain.enums.SubscriptionTier;
import com.spring.fito.exception.BadRequestException;
import com.spring.fito.exception.UnauthenticatedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/**
 * Authentication → StylistIdentity 변환 가드
 *
 * - JWT 인증: subject가 owner, tier claim으로 구독 등급 결정
 * - 익명 호출: X-Client-Id 헤더로 게스트 세션을 구분 (헤더 없으면 400)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StylistIdentityResolver {

    public static final String CLIENT_ID_HEADER = "X-Client-Id";

    private final JwtProperties jwtProperties;

    public StylistIdentity resolve(Authentication authentication, String clientId) {
        if (isSignedIn(authentication)) {
            return StylistIdentity.member(authentication.getName(), tierOf(authentication));
        }

        if (clientId == null || clientId.isBlank()) {
            throw new BadRequestException("Missing " + CLIENT_ID_HEADER + " header for guest session");
        }
        return StylistIdentity.guest(clientId.trim());
    }

    /** 로그인 필수 API용 */
    public StylistIdentity requireMember(Authentication authentication) {
        if (!isSignedIn(authentication)) {
            throw new UnauthenticatedException("Please sign in to use AI styling");
        }
        return StylistIdentity.member(authentication.getName(), tierOf(authentication));
    }

    private SubscriptionTier tierOf(Authentication authentication) {
        if (authentication instanceof JwtAuthenticationToken jwtAuth) {
            Object claim = jwtAuth.getToken().getClaims().get(jwtProperties.tierClaim());
            SubscriptionTier tier = SubscriptionTier.fromClaim(claim);
            log.debug("🔑 [AUTH] subject={} tier={}", authentication.getName(), tier);
            return tier;
        }
        return SubscriptionTier.FREE;
    }

    private static boolean isSignedIn(Authentication authentication) {
        return authentication != null
            && authentication.isAuthenticated()
            && !(authentication instanceof AnonymousAuthenticationToken);
    }
}
