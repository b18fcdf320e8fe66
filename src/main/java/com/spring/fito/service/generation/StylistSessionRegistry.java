package com.spring.fito.service.generation;

import com.spring.fito.config.StylistProperties;
import com.spring.fito.external.OutfitSuggestionClient;
import com.spring.fito.security.StylistIdentity;
import com.spring.fito.service.quota.UsageQuotaService;
import com.spring.fito.service.styling.AiSuggestionReconciler;
import com.spring.fito.service.styling.LocalOutfitComposer;
import com.spring.fito.service.styling.StyleNoteCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * owner → 코디 세션(오케스트레이터) 보관소 (메모리)
 *
 * - 조회/생성 시마다 마지막 접근 시각 갱신
 * - stylist.session-idle-timeout 동안 접근이 없고 생성 중이 아닌 세션은 evictIdle()에서 제거
 */
@Slf4j
@Component
public class StylistSessionRegistry {

    private final OutfitSuggestionClient transport;
    private final UsageQuotaService quotaService;
    private final LocalOutfitComposer localComposer;
    private final AiSuggestionReconciler reconciler;
    private final StyleNoteCatalog styleNotes;
    private final ProgressTicker progressTicker;
    private final Clock clock;
    private final Duration idleTimeout;

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    public StylistSessionRegistry(OutfitSuggestionClient transport,
                                  UsageQuotaService quotaService,
                                  LocalOutfitComposer localComposer,
                                  AiSuggestionReconciler reconciler,
                                  StyleNoteCatalog styleNotes,
                                  @Qualifier("stylistProgressScheduler") TaskScheduler progressScheduler,
                                  StylistProperties props,
                                  Clock clock) {
        this.transport = transport;
        this.quotaService = quotaService;
        this.localComposer = localComposer;
        this.reconciler = reconciler;
        this.styleNotes = styleNotes;
        this.progressTicker = new ProgressTicker(progressScheduler, props.progressInterval());
        this.clock = clock;
        this.idleTimeout = props.sessionIdleTimeout();
    }

    public OutfitGenerationOrchestrator sessionFor(StylistIdentity identity) {
        Instant now = clock.instant();
        Session session = sessions.compute(identity.owner(), (owner, current) -> {
            Session target = current != null ? current : open(identity);
            return target.touch(now);
        });
        session.gateway().bind(identity);
        return session.orchestrator();
    }

    public Optional<OutfitGenerationOrchestrator> find(String owner) {
        Instant now = clock.instant();
        return Optional.ofNullable(sessions.computeIfPresent(owner, (key, current) -> current.touch(now)))
            .map(Session::orchestrator);
    }

    /** 유휴 세션 제거, 제거 건수 반환 */
    public int evictIdle() {
        Instant cutoff = clock.instant().minus(idleTimeout);
        int evicted = 0;
        for (Map.Entry<String, Session> entry : sessions.entrySet()) {
            Session session = entry.getValue();
            // 그 사이 touch 되었다면 값이 바뀌어 제거되지 않음
            if (session.isIdleSince(cutoff) && sessions.remove(entry.getKey(), session)) {
                evicted++;
            }
        }
        return evicted;
    }

    public int size() {
        return sessions.size();
    }

    private Session open(StylistIdentity identity) {
        log.debug("[GEN] Opening stylist session for owner={}", identity.owner());
        AiStylistGateway gateway = new AiStylistGateway(identity, transport, quotaService);
        OutfitGenerationOrchestrator orchestrator = new OutfitGenerationOrchestrator(
            identity.owner(), gateway, localComposer, reconciler, styleNotes, progressTicker);
        return new Session(gateway, orchestrator, clock.instant());
    }

    private record Session(AiStylistGateway gateway, OutfitGenerationOrchestrator orchestrator, Instant lastAccess) {

        Session touch(Instant now) {
            return new Session(gateway, orchestrator, now);
        }

        boolean isIdleSince(Instant cutoff) {
            return lastAccess.isBefore(cutoff) && !orchestrator.snapshot().generating();
        }
    }
}
