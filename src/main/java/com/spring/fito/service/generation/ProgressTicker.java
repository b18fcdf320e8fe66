package com.spring.fito.service.generation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * 생성 중 진행 메시지 순환기
 *
 * 명시적으로 취소하지 않는다. 매 틱마다 active를 확인하고 false면 스스로 종료한다.
 */
@Slf4j
public class ProgressTicker {

    public static final List<String> MESSAGES = List.of(
        "Analyzing your wardrobe...",
        "Considering color harmony...",
        "Checking style compatibility...",
        "Finding the perfect match...",
        "Almost there..."
    );

    private final TaskScheduler scheduler;
    private final Duration interval;

    public ProgressTicker(TaskScheduler scheduler, Duration interval) {
        this.scheduler = scheduler;
        this.interval = interval;
    }

    /**
     * 첫 메시지를 즉시 내보내고, 이후 interval마다 다음 메시지로 교체
     */
    public ScheduledFuture<?> start(BooleanSupplier active, Consumer<String> sink) {
        sink.accept(MESSAGES.get(0));

        AtomicInteger index = new AtomicInteger();
        AtomicReference<ScheduledFuture<?>> self = new AtomicReference<>();

        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(() -> {
            if (!active.getAsBoolean()) {
                ScheduledFuture<?> handle = self.get();
                if (handle != null) {
                    handle.cancel(false);
                }
                return;
            }
            sink.accept(MESSAGES.get(index.incrementAndGet() % MESSAGES.size()));
        }, Instant.now().plus(interval), interval);

        self.set(future);
        return future;
    }
}
