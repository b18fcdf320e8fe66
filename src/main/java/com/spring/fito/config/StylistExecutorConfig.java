package com.spring.fito.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.Random;
import java.util.random.RandomGenerator;

/**
 * 코디 생성용 실행기 / 스케줄러 / 난수원
 *
 * - stylistAiExecutor: 외부 AI 호출 (블로킹 HTTP + 재시도 백오프)
 * - stylistProgressScheduler: 진행 메시지 티커 + 월간 사용량 리셋
 * - stylistRandom: 동점 처리 / 문구 선택 (테스트에서는 시드 고정 Random으로 교체)
 * - stylistClock: 월간 사용량 기간 계산, 유휴 세션 판정
 */
@Configuration
@EnableConfigurationProperties(StylistProperties.class)
public class StylistExecutorConfig {

    @Bean(name = "stylistAiExecutor")
    public ThreadPoolTaskExecutor stylistAiExecutor(StylistProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.aiPoolSize());
        executor.setMaxPoolSize(props.aiPoolSize() * 2);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("stylist-ai-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    @Bean(name = "stylistProgressScheduler")
    public ThreadPoolTaskScheduler stylistProgressScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("stylist-tick-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    @Bean(name = "stylistRandom")
    public RandomGenerator stylistRandom() {
        return new Random();
    }

    @Bean(name = "stylistClock")
    public Clock stylistClock() {
        return Clock.systemDefaultZone();
    }
}
