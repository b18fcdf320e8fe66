package com.spring.fito.dto.openai;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * OpenAI 호환 ChatCompletion 요청 DTO
 * - null 필드는 직렬화에서 제외
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OpenAiChatRequest(
    String model,
    List<OpenAiMessage> messages,
    Double temperature,
    Boolean stream,
    @JsonProperty("response_format") ResponseFormat responseFormat
) {
    /** JSON 응답 강제 (스트리밍 없음) */
    public static OpenAiChatRequest json(String model, List<OpenAiMessage> messages, Double temperature) {
        return new OpenAiChatRequest(model, messages, temperature, false, ResponseFormat.JSON_OBJECT);
    }

    public record ResponseFormat(String type) {
        public static final ResponseFormat JSON_OBJECT = new ResponseFormat("json_object");
    }
}
