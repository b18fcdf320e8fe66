package com.spring.fito.service.generation;

import com.spring.fito.domain.enums.GenerationPhase;
import com.spring.fito.domain.enums.GenerationSource;
import com.spring.fito.domain.enums.GenerationStatus;
import com.spring.fito.domain.outfit.AiSuggestion;
import com.spring.fito.domain.outfit.GeneratedOutfit;
import com.spring.fito.exception.ErrorCode;
import com.spring.fito.exception.QuotaExceededException;
import com.spring.fito.exception.UnauthenticatedException;
import com.spring.fito.external.OutfitSuggestionClient;
import com.spring.fito.service.styling.AiSuggestionReconciler;
import com.spring.fito.service.styling.LocalOutfitComposer;
import com.spring.fito.service.styling.StyleNoteCatalog;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * 코디 생성 상태 머신 (세션 1개당 1개)
 *
 * IDLE → VALIDATING → (AI_PATH | LOCAL_PATH) → COMPLETED | FAILED
 *
 * - 검증 실패는 비동기 작업 없이 즉시 완료된 future로 반환
 * - AI 경로에서 NOT_AUTHENTICATED / QUOTA_EXCEEDED 만 종료 사유, 나머지 실패는 로컬 매칭으로 조용히 폴백
 * - 요청마다 generationId를 발급하고, 가장 최근 요청만 관측 상태를 갱신한다 (last request wins)
 * - 채택되지 않은 AI 제안은 aiClient.discard로 돌려준다
 */
@Slf4j
public class OutfitGenerationOrchestrator {

    private final String owner;
    private final OutfitSuggestionClient aiClient;
    private final LocalOutfitComposer localComposer;
    private final AiSuggestionReconciler reconciler;
    private final StyleNoteCatalog styleNotes;
    private final ProgressTicker progressTicker;

    private final AtomicLong generationSeq = new AtomicLong();
    private final AtomicLong fallbackCount = new AtomicLong();
    private final AtomicReference<GenerationSnapshot> state = new AtomicReference<>(GenerationSnapshot.idle());

    public OutfitGenerationOrchestrator(String owner,
                                        OutfitSuggestionClient aiClient,
                                        LocalOutfitComposer localComposer,
                                        AiSuggestionReconciler reconciler,
                                        StyleNoteCatalog styleNotes,
                                        ProgressTicker progressTicker) {
        this.owner = owner;
        this.aiClient = aiClient;
        this.localComposer = localComposer;
        this.reconciler = reconciler;
        this.styleNotes = styleNotes;
        this.progressTicker = progressTicker;
    }

    public CompletableFuture<GenerationResult> generate(GenerationRequest request) {
        long id = generationSeq.incrementAndGet();
        state.updateAndGet(current -> current.lastGenerationId() > id ? current : current.begin(id));

        // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
        // 1. 검증 (비동기 작업 시작 전)
        // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
        ErrorCode rejection = validate(request);
        if (rejection != null) {
            log.info("[GEN] #{} rejected: owner={} reason={}", id, owner, rejection);
            return CompletableFuture.completedFuture(finish(id, GenerationResult.failed(id, rejection)));
        }

        // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
        // 2. 경로 선택
        // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
        if (!request.aiAvailable()) {
            enter(id, GenerationPhase.LOCAL_PATH);
            startTicker(id);
            return CompletableFuture.completedFuture(finish(id, composeLocally(id, request)));
        }

        enter(id, GenerationPhase.AI_PATH);
        startTicker(id);
        long start = System.currentTimeMillis();

        return callAi(request).handle((suggestion, error) -> {
            if (error != null) {
                if (isSuperseded(id)) {
                    log.debug("[GEN] #{} superseded by #{}, discarding AI failure", id, generationSeq.get());
                    return GenerationResult.superseded(id);
                }
                return finish(id, recover(id, unwrap(error), request));
            }
            if (isSuperseded(id)) {
                log.debug("[GEN] #{} superseded by #{}, discarding AI outcome", id, generationSeq.get());
                aiClient.discard(suggestion);
                return GenerationResult.superseded(id);
            }
            GenerationResult result = finish(id, fromSuggestion(id, suggestion, request));
            if (result.status() == GenerationStatus.SUPERSEDED) {
                aiClient.discard(suggestion);
            } else {
                log.info("⏱️ [PERF] #{} AI path: {}ms", id, System.currentTimeMillis() - start);
            }
            return result;
        });
    }

    public GenerationSnapshot snapshot() {
        return state.get();
    }

    /** 관측 상태 초기화, 진행 중인 요청의 결과는 이후 SUPERSEDED 처리 */
    public void reset() {
        generationSeq.incrementAndGet();
        state.set(GenerationSnapshot.idle());
    }

    /** AI 실패 → 로컬 폴백 누적 횟수 */
    public long fallbackCount() {
        return fallbackCount.get();
    }

    public String owner() {
        return owner;
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // 내부 로직
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    private static ErrorCode validate(GenerationRequest request) {
        if (request.prompt() == null || request.prompt().isBlank()) {
            return ErrorCode.EMPTY_PROMPT;
        }
        if (request.wardrobe().isEmpty()) {
            return ErrorCode.EMPTY_WARDROBE;
        }
        if (request.quota() != null && request.quota().isExhausted()) {
            return ErrorCode.QUOTA_EXCEEDED;
        }
        return null;
    }

    private CompletableFuture<AiSuggestion> callAi(GenerationRequest request) {
        try {
            return aiClient.generateSuggestion(request.prompt(), request.wardrobe(), null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private GenerationResult fromSuggestion(long id, AiSuggestion suggestion, GenerationRequest request) {
        GeneratedOutfit outfit = reconciler.reconcile(suggestion, request.wardrobe());
        return GenerationResult.completed(id, GenerationSource.AI, outfit,
            suggestion.reasoning(), suggestion.styleTip());
    }

    private GenerationResult recover(long id, Throwable cause, GenerationRequest request) {
        if (cause instanceof UnauthenticatedException) {
            return GenerationResult.failed(id, ErrorCode.NOT_AUTHENTICATED, cause.getMessage());
        }
        if (cause instanceof QuotaExceededException) {
            return GenerationResult.failed(id, ErrorCode.QUOTA_EXCEEDED, cause.getMessage());
        }

        long total = fallbackCount.incrementAndGet();
        log.warn("⚠️ [FALLBACK] #{} AI failed ({}: {}), using local matching | owner={} fallbacks={}",
            id, cause.getClass().getSimpleName(), cause.getMessage(), owner, total);

        enter(id, GenerationPhase.LOCAL_PATH);
        return composeLocally(id, request);
    }

    private GenerationResult composeLocally(long id, GenerationRequest request) {
        GeneratedOutfit outfit = localComposer.compose(request.prompt(), request.wardrobe());
        if (!outfit.isValid()) {
            return GenerationResult.completed(id, GenerationSource.LOCAL, outfit, null, null);
        }
        return GenerationResult.completed(id, GenerationSource.LOCAL, outfit,
            styleNotes.commentFor(request.prompt()), styleNotes.tipFor(request.prompt()));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private boolean isSuperseded(long id) {
        return generationSeq.get() != id;
    }

    private void enter(long id, GenerationPhase phase) {
        update(id, current -> current.enter(phase, current.statusMessage()));
    }

    private GenerationResult finish(long id, GenerationResult result) {
        if (isSuperseded(id)) {
            return GenerationResult.superseded(id);
        }
        update(id, current -> current.finish(result));
        return result;
    }

    private void startTicker(long id) {
        progressTicker.start(
            () -> !isSuperseded(id) && state.get().generating(),
            message -> update(id, current -> current.generating() ? current.withStatusMessage(message) : current)
        );
    }

    private void update(long id, UnaryOperator<GenerationSnapshot> change) {
        state.updateAndGet(current -> isSuperseded(id) ? current : change.apply(current));
    }
}
