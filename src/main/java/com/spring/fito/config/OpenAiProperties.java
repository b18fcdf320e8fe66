package com.spring.fito.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * OpenRouter(OpenAI 호환) 호출을 위한 설정 프로퍼티
 */
@ConfigurationProperties(prefix = "openai")
public record OpenAiProperties(
    String apiKey,
    String baseUrl,
    String model,
    Double temperature,
    String appReferer,
    String appTitle
) {
    public OpenAiProperties {
        if (temperature == null) {
            temperature = 0.7;
        }
    }
}
