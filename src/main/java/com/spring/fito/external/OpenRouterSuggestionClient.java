package com.spring.fito.external;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spring.fito.config.OpenAiProperties;
import com.spring.fito.domain.outfit.AiSuggestion;
import com.spring.fito.domain.wardrobe.ClothingItem;
import com.spring.fito.dto.openai.AiOutfitJson;
import com.spring.fito.dto.openai.OpenAiChatRequest;
import com.spring.fito.dto.openai.OpenAiMessage;
import com.spring.fito.exception.ExternalApiException;
import com.spring.fito.service.prompt.OutfitPromptAssembler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * OpenRouter 기반 AI 코디 추천
 *
 * 1. 카테고리별 아이템 목록으로 프롬프트 조립
 * 2. chatCompletion (재시도 포함) 호출, AI 전용 스레드 풀에서 실행
 * 3. 응답에서 첫 JSON 블록 추출 → 파싱
 * 4. 요청에 없던 ID 제거, 기본 문구 적용
 * 5. top/bottom/shoes 모두 비었으면 "상황에 맞는 옷 없음"으로 실패 처리
 */
@Slf4j
@Component
public class OpenRouterSuggestionClient implements OutfitSuggestionClient {

    static final String DEFAULT_REASONING = "A stylish outfit for your occasion!";
    static final String DEFAULT_STYLE_TIP = "Accessorize to make it your own!";

    private static final Pattern JSON_BLOCK = Pattern.compile("\\{[\\s\\S]*\\}");

    private final OpenRouterClient openRouterClient;
    private final OutfitPromptAssembler promptAssembler;
    private final OpenAiProperties props;
    private final ObjectMapper objectMapper;
    private final TaskExecutor aiExecutor;

    public OpenRouterSuggestionClient(OpenRouterClient openRouterClient,
                                      OutfitPromptAssembler promptAssembler,
                                      OpenAiProperties props,
                                      ObjectMapper objectMapper,
                                      @Qualifier("stylistAiExecutor") TaskExecutor aiExecutor) {
        this.openRouterClient = openRouterClient;
        this.promptAssembler = promptAssembler;
        this.props = props;
        this.objectMapper = objectMapper;
        this.aiExecutor = aiExecutor;
    }

    @Override
    public CompletableFuture<AiSuggestion> generateSuggestion(String prompt,
                                                              List<ClothingItem> availableItems,
                                                              String userStyle) {
        List<ClothingItem> items = List.copyOf(availableItems);
        return CompletableFuture.supplyAsync(() -> requestSuggestion(prompt, items, userStyle), aiExecutor::execute);
    }

    AiSuggestion requestSuggestion(String prompt, List<ClothingItem> items, String userStyle) {
        long start = System.currentTimeMillis();

        OpenAiChatRequest request = OpenAiChatRequest.json(
            props.model(),
            List.of(
                OpenAiMessage.system(OutfitPromptAssembler.SYSTEM_PROMPT),
                OpenAiMessage.user(promptAssembler.assembleUserPrompt(prompt, items, userStyle))
            ),
            props.temperature()
        );

        String raw = openRouterClient.chatCompletion(request);
        AiOutfitJson json = parse(raw);

        if (json.notSuitable()) {
            throw new ExternalApiException("Model found nothing suitable for the occasion");
        }

        Set<String> knownIds = items.stream().map(ClothingItem::id).collect(Collectors.toSet());
        List<String> selected = new ArrayList<>(4);
        addIfKnown(selected, json.topId(), knownIds);
        addIfKnown(selected, json.bottomId(), knownIds);
        addIfKnown(selected, json.shoesId(), knownIds);
        addIfKnown(selected, json.outerwearId(), knownIds);

        log.info("⏱️ [PERF] AI suggestion: {}ms | items={} | selected={}",
            System.currentTimeMillis() - start, items.size(), selected.size());

        return new AiSuggestion(
            selected,
            orDefault(json.reasoning(), DEFAULT_REASONING),
            orDefault(json.styleTip(), DEFAULT_STYLE_TIP)
        );
    }

    private AiOutfitJson parse(String raw) {
        Matcher matcher = JSON_BLOCK.matcher(raw);
        if (!matcher.find()) {
            throw new ExternalApiException("AI response did not contain a JSON object");
        }
        try {
            return objectMapper.readValue(matcher.group(), AiOutfitJson.class);
        } catch (JsonProcessingException e) {
            log.warn("[AI] Malformed outfit JSON: {}", e.getOriginalMessage());
            throw new ExternalApiException("AI response JSON could not be parsed", e);
        }
    }

    private static void addIfKnown(List<String> selected, String id, Set<String> knownIds) {
        if (id != null && knownIds.contains(id)) {
            selected.add(id);
        }
    }

    private static String orDefault(String value, String fallback) {
        return (value == null || value.isBlank()) ? fallback : value;
    }
}
