package com.spring.fito.service.quota;

import com.spring.fito.config.StylistProperties;
import com.spring.fito.domain.enums.SubscriptionTier;
import com.spring.fito.security.StylistIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.YearMonth;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 월간 AI 코디 생성 사용량 관리 (메모리)
 *
 * - FREE: stylist.free-monthly-limit 회 / 월
 * - PREMIUM: 무제한 (사용량은 집계만)
 * - 게스트: 쿼터 대상 아님 (statusOf → null, AI 경로를 쓰지 않음)
 * - AI 호출 전에 tryReserve로 1회분을 선점하고, 결과가 쓰이지 않으면 release로 반환
 * - 카운터는 월이 바뀌면 0부터 다시 센다 (UsageResetScheduler가 월초에 일괄 정리)
 */
@Slf4j
@Service
public class UsageQuotaService {

    private final StylistProperties props;
    private final Clock clock;
    private final Map<String, MonthlyUsage> usages = new ConcurrentHashMap<>();

    public UsageQuotaService(StylistProperties props, Clock clock) {
        this.props = props;
        this.clock = clock;
    }

    public QuotaStatus statusOf(StylistIdentity identity) {
        if (identity == null || !identity.authenticated()) {
            return null;
        }
        int used = usedThisMonth(identity.owner());
        if (identity.tier() == SubscriptionTier.PREMIUM) {
            return QuotaStatus.unlimited(used);
        }
        return QuotaStatus.limited(props.freeMonthlyLimit(), used);
    }

    /**
     * 한도 확인과 사용량 1 증가를 원자적으로 수행
     *
     * @return 예약 성공 여부 (게스트는 집계 없이 항상 true)
     */
    public boolean tryReserve(StylistIdentity identity) {
        if (identity == null || !identity.authenticated()) {
            return true;
        }
        YearMonth now = YearMonth.now(clock);
        boolean unlimited = identity.tier() == SubscriptionTier.PREMIUM;
        AtomicBoolean reserved = new AtomicBoolean();

        MonthlyUsage updated = usages.compute(identity.owner(), (owner, current) -> {
            int used = countIn(current, now);
            if (!unlimited && used >= props.freeMonthlyLimit()) {
                return current;
            }
            reserved.set(true);
            return new MonthlyUsage(now, used + 1);
        });

        if (reserved.get()) {
            log.debug("[QUOTA] owner={} tier={} used={} ({})", identity.owner(), identity.tier(), updated.count(), now);
        }
        return reserved.get();
    }

    /** 채택되지 않은 AI 결과 / 실패한 호출의 예약분 반환 */
    public void release(StylistIdentity identity) {
        if (identity == null || !identity.authenticated()) {
            return;
        }
        YearMonth now = YearMonth.now(clock);
        usages.computeIfPresent(identity.owner(), (owner, current) -> {
            int used = countIn(current, now);
            return used <= 1 ? null : new MonthlyUsage(now, used - 1);
        });
        log.debug("[QUOTA] owner={} reservation released", identity.owner());
    }

    /** 지난 달 카운터 제거, 제거 건수 반환 */
    public int resetExpired() {
        YearMonth now = YearMonth.now(clock);
        int before = usages.size();
        usages.values().removeIf(usage -> !usage.period().equals(now));
        return before - usages.size();
    }

    private int usedThisMonth(String owner) {
        return countIn(usages.get(owner), YearMonth.now(clock));
    }

    private static int countIn(MonthlyUsage usage, YearMonth period) {
        if (usage == null || !usage.period().equals(period)) {
            return 0;
        }
        return usage.count();
    }

    private record MonthlyUsage(YearMonth period, int count) {}
}
