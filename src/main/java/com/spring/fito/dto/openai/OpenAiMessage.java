package com.spring.fito.dto.openai;

/**
 * OpenAI 호환 메시지 단위
 */
public record OpenAiMessage(String role, String content) {
    public static OpenAiMessage system(String content) { return new OpenAiMessage("system", content); }
    public static OpenAiMessage user(String content) { return new OpenAiMessage("user", content); }
}
