package com.spring.fito.service.scheduler;

import com.spring.fito.service.generation.StylistSessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 유휴 코디 세션 정리 스케줄러
 * - 기본 5분마다, stylist.session-idle-timeout 동안 접근 없는 세션 제거
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionEvictionScheduler {

    private final StylistSessionRegistry sessionRegistry;

    @Scheduled(fixedDelayString = "${stylist.session-sweep-interval:PT5M}")
    public void evictIdleSessions() {
        int evicted = sessionRegistry.evictIdle();
        if (evicted > 0) {
            log.info("🧹 [SESSION] Evicted {} idle session(s), {} remaining", evicted, sessionRegistry.size());
        }
    }
}
