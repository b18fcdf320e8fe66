package com.spring.fito.service.generation;

import com.spring.fito.config.StylistProperties;
import com.spring.fito.domain.enums.SubscriptionTier;
import com.spring.fito.domain.outfit.AiSuggestion;
import com.spring.fito.domain.wardrobe.ClothingItem;
import com.spring.fito.external.OutfitSuggestionClient;
import com.spring.fito.security.StylistIdentity;
import com.spring.fito.service.quota.UsageQuotaService;
import com.spring.fito.service.styling.AiSuggestionReconciler;
import com.spring.fito.service.styling.CategoryMatcher;
import com.spring.fito.service.styling.LocalOutfitComposer;
import com.spring.fito.service.styling.StyleNoteCatalog;
import com.spring.fito.service.styling.TagLexicon;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;

import static com.spring.fito.domain.enums.ClothingCategory.TOP;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StylistSessionRegistryTest {

    private final MovableClock clock = new MovableClock(Instant.parse("2026-03-10T09:00:00Z"));
    private final OutfitSuggestionClient transport = mock(OutfitSuggestionClient.class);
    private final UsageQuotaService quotaService = mock(UsageQuotaService.class);

    private StylistSessionRegistry registry;

    @BeforeEach
    void setUp() {
        Random random = new Random(3);
        registry = new StylistSessionRegistry(
            transport,
            quotaService,
            new LocalOutfitComposer(new TagLexicon(), new CategoryMatcher(random)),
            new AiSuggestionReconciler(),
            new StyleNoteCatalog(random),
            mock(TaskScheduler.class),
            new StylistProperties(null, null, null, null, Duration.ofMinutes(30)),
            clock
        );
    }

    @Test
    void sameOwnerSharesOneSession() {
        OutfitGenerationOrchestrator first = registry.sessionFor(StylistIdentity.member("user-1", SubscriptionTier.FREE));
        OutfitGenerationOrchestrator again = registry.sessionFor(StylistIdentity.member("user-1", SubscriptionTier.PREMIUM));
        OutfitGenerationOrchestrator other = registry.sessionFor(StylistIdentity.guest("device-9"));

        assertThat(again).isSameAs(first);
        assertThat(other).isNotSameAs(first);
        assertThat(other.owner()).isEqualTo("guest:device-9");
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void findReturnsOnlyOpenedSessions() {
        assertThat(registry.find("user-2")).isEmpty();

        registry.sessionFor(StylistIdentity.member("user-2", SubscriptionTier.FREE));

        assertThat(registry.find("user-2")).isPresent();
    }

    @Test
    void idleGuestSessionsAreEvicted() {
        for (int i = 0; i < 100; i++) {
            registry.sessionFor(StylistIdentity.guest("device-" + i));
        }
        assertThat(registry.size()).isEqualTo(100);

        clock.advance(Duration.ofMinutes(31));

        assertThat(registry.evictIdle()).isEqualTo(100);
        assertThat(registry.size()).isZero();
        assertThat(registry.find("guest:device-0")).isEmpty();
    }

    @Test
    void recentlyUsedSessionsSurviveSweep() {
        registry.sessionFor(StylistIdentity.guest("stale"));
        registry.sessionFor(StylistIdentity.guest("polling"));

        clock.advance(Duration.ofMinutes(20));
        registry.find("guest:polling");
        clock.advance(Duration.ofMinutes(20));

        assertThat(registry.evictIdle()).isEqualTo(1);
        assertThat(registry.find("guest:stale")).isEmpty();
        assertThat(registry.find("guest:polling")).isPresent();
    }

    @Test
    void sessionWithAiCallInFlightIsKept() {
        StylistIdentity member = StylistIdentity.member("user-3", SubscriptionTier.FREE);
        when(quotaService.tryReserve(member)).thenReturn(true);
        when(transport.generateSuggestion(anyString(), anyList(), any())).thenReturn(new CompletableFuture<AiSuggestion>());
        List<ClothingItem> wardrobe = List.of(ClothingItem.of("t1", TOP, "Casual"));

        registry.sessionFor(member).generate(new GenerationRequest("brunch", wardrobe, true, null));
        clock.advance(Duration.ofHours(2));

        assertThat(registry.evictIdle()).isZero();
        assertThat(registry.size()).isEqualTo(1);
    }

    private static final class MovableClock extends Clock {

        private Instant now;

        MovableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            this.now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
