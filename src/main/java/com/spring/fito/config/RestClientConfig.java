package com.spring.fito.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

/**
 * OpenRouter API 통신용 RestClient 설정
 */
@Configuration
@EnableConfigurationProperties(OpenAiProperties.class)
public class RestClientConfig {

    @Bean
    public RestClient openRouterRestClient(OpenAiProperties props) {
        return openRouterBuilder(props).build();
    }

    /**
     * 공통 헤더가 적용된 빌더
     * - 테스트에서 MockRestServiceServer.bindTo(builder)로 바인딩할 수 있도록 분리
     */
    public static RestClient.Builder openRouterBuilder(OpenAiProperties props) {
        return RestClient.builder()
            .baseUrl(props.baseUrl())
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.apiKey())
            // 앱 식별용 (선택)
            .defaultHeader("HTTP-Referer", props.appReferer())
            .defaultHeader("X-Title", props.appTitle())
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
    }
}
