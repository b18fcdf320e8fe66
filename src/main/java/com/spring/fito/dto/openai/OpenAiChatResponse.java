package com.spring.fito.dto.openai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.spring.fito.exception.ExternalApiException;

import java.util.List;

/**
 * OpenAI 호환 ChatCompletion 응답 DTO
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OpenAiChatResponse(
    List<Choice> choices
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Choice(Message message) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Message(String role, String content) {}

    public String firstContentOrThrow() {
        if (choices == null || choices.isEmpty() || choices.get(0).message() == null) {
            throw new ExternalApiException("OpenRouter response has no choices");
        }
        String content = choices.get(0).message().content();
        if (content == null || content.isBlank()) {
            throw new ExternalApiException("OpenRouter response content is empty");
        }
        return content;
    }
}
