package com.spring.fito.external;

import com.spring.fito.dto.openai.OpenAiChatRequest;
import com.spring.fito.dto.openai.OpenAiChatResponse;
import com.spring.fito.exception.ExternalApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * OpenRouter(OpenAI 호환) API 호출 전용 Client
 *
 * - 지수 백오프 재시도: 401/429/5xx 및 네트워크 오류
 * - 재시도 소진 / 재시도 불가 오류는 ExternalApiException으로 변환 (호출측에서 로컬 매칭 폴백)
 */
@Component
@Slf4j
public class OpenRouterClient {

    /** 최대 재시도 횟수 */
    static final int MAX_RETRIES = 3;

    /** 첫 재시도 전 대기 시간 (ms), 이후 2배씩 증가 */
    static final long INITIAL_BACKOFF_MS = 500;

    /** 재시도 대상 HTTP 상태 코드 */
    private static final int[] RETRYABLE_STATUS_CODES = {401, 429, 500, 502, 503, 504};

    private final RestClient openRouterRestClient;
    private final long initialBackoffMs;

    @Autowired
    public OpenRouterClient(RestClient openRouterRestClient) {
        this(openRouterRestClient, INITIAL_BACKOFF_MS);
    }

    OpenRouterClient(RestClient openRouterRestClient, long initialBackoffMs) {
        this.openRouterRestClient = openRouterRestClient;
        this.initialBackoffMs = initialBackoffMs;
    }

    public String chatCompletion(OpenAiChatRequest request) {
        RuntimeException lastException = null;

        for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
            try {
                if (attempt > 0) {
                    long backoff = initialBackoffMs * (1L << (attempt - 1));
                    log.warn("🔄 [RETRY] OpenRouter chatCompletion attempt {}/{} after {}ms | model={}",
                        attempt, MAX_RETRIES, backoff, request.model());
                    Thread.sleep(backoff);
                }

                long start = System.currentTimeMillis();
                OpenAiChatResponse response = openRouterRestClient.post()
                    .uri("/chat/completions")
                    .body(request)
                    .retrieve()
                    .body(OpenAiChatResponse.class);
                log.debug("⏱️ [PERF] OpenRouter call: {}ms | model={}", System.currentTimeMillis() - start, request.model());

                if (response == null) {
                    throw new ExternalApiException("OpenRouter returned an empty body");
                }

                if (attempt > 0) {
                    log.info("✅ [RETRY] OpenRouter succeeded on attempt {}", attempt + 1);
                }

                return response.firstContentOrThrow();

            } catch (RestClientResponseException e) {
                lastException = e;
                int statusCode = e.getStatusCode().value();

                if (!isRetryable(statusCode)) {
                    log.error("❌ [RETRY] Non-retryable error {}. body={}", statusCode, abbreviate(e.getResponseBodyAsString()));
                    throw new ExternalApiException("OpenRouter call failed (" + statusCode + ")", e);
                }

                log.warn("⚠️ [RETRY] Retryable error {} on attempt {}/{} | body={}",
                    statusCode, attempt + 1, MAX_RETRIES + 1, abbreviate(e.getResponseBodyAsString()));

            } catch (ResourceAccessException e) {
                lastException = e;
                log.warn("⚠️ [RETRY] I/O error on attempt {}/{}: {}", attempt + 1, MAX_RETRIES + 1, e.getMessage());

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ExternalApiException("Interrupted while retrying OpenRouter call", e);
            }
        }

        log.error("❌ [RETRY] All {} attempts exhausted for model={}", MAX_RETRIES + 1, request.model());
        throw new ExternalApiException(
            "OpenRouter call failed after " + (MAX_RETRIES + 1) + " attempts", lastException);
    }

    private boolean isRetryable(int statusCode) {
        for (int code : RETRYABLE_STATUS_CODES) {
            if (code == statusCode) return true;
        }
        return false;
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.substring(0, Math.min(200, body.length()));
    }
}
