package com.spring.fito.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 코디 생성 관련 설정 값
 *
 * @param aiEnabled        false면 로그인 사용자도 항상 로컬 매칭만 사용
 * @param freeMonthlyLimit FREE 등급 월 생성 한도
 * @param progressInterval 진행 메시지 교체 주기
 * @param aiPoolSize       AI 호출 전용 스레드 수
 * @param sessionIdleTimeout 마지막 접근 후 이 시간이 지난 세션은 정리 대상
 */
@ConfigurationProperties(prefix = "stylist")
public record StylistProperties(
    Boolean aiEnabled,
    Integer freeMonthlyLimit,
    Duration progressInterval,
    Integer aiPoolSize,
    Duration sessionIdleTimeout
) {
    public StylistProperties {
        if (aiEnabled == null) aiEnabled = true;
        if (freeMonthlyLimit == null) freeMonthlyLimit = 5;
        if (progressInterval == null) progressInterval = Duration.ofMillis(1500);
        if (aiPoolSize == null) aiPoolSize = 4;
        if (sessionIdleTimeout == null) sessionIdleTimeout = Duration.ofMinutes(30);
    }

    public static StylistProperties defaults() {
        return new StylistProperties(null, null, null, null, null);
    }
}
