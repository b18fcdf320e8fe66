package com.spring.fito.service.scheduler;

import com.spring.fito.service.quota.UsageQuotaService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 월간 사용량 리셋 스케줄러
 * - 매월 1일 00:00, 지난 달 카운터 일괄 정리
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UsageResetScheduler {

    private final UsageQuotaService usageQuotaService;

    @Scheduled(cron = "${stylist.usage-reset-cron:0 0 0 1 * *}")
    public void resetMonthlyUsage() {
        int cleared = usageQuotaService.resetExpired();
        log.info("🔄 [QUOTA] Monthly usage reset: {} counter(s) cleared", cleared);
    }
}
