package com.my.caddy.adapter.out.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.caddy.config.AppConfig;
import com.my.caddy.domain.exception.ClassifierUnavailableException;
import com.my.caddy.domain.exception.IntentParseException;
import com.my.caddy.domain.model.ConversationTurn;
import com.my.caddy.domain.model.Entities;
import com.my.caddy.domain.model.IntentType;
import com.my.caddy.domain.model.Lie;
import com.my.caddy.domain.model.LlmIntentResult;
import com.my.caddy.domain.model.SessionSnapshot;
import com.my.caddy.domain.port.out.LlmPort;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.service.AiServices;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 왜: LLM 호출을 도메인 포트 계약에 맞게 감싸 의도/신뢰도/엔티티를 구조화된 결과로 제공하기 위함.
 *
 * <p>재시도하지 않는다. 전송 실패는 {@link ClassifierUnavailableException}, 해석 실패는 {@link IntentParseException}.
 */
@ApplicationScoped
public class OpenAiLlmAdapter implements LlmPort {

    private static final int HISTORY_TURNS = 4;

    private final IntentParser intentParser;
    private final ObjectMapper objectMapper;

    @Inject
    public OpenAiLlmAdapter(AppConfig appConfig, ObjectMapper objectMapper) {
        String apiKey = appConfig.openai().apiKey().orElse("");
        OpenAiChatModel model = OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(appConfig.openai().model())
                .temperature(appConfig.openai().temperature())
                .timeout(Duration.ofMillis(appConfig.classifier().voiceTimeoutMs()))
                .maxRetries(0)
                .build();
        this.intentParser = AiServices.builder(IntentParser.class)
                .chatLanguageModel(model)
                .build();
        this.objectMapper = objectMapper;
    }

    OpenAiLlmAdapter(IntentParser intentParser, ObjectMapper objectMapper) {
        this.intentParser = intentParser;
        this.objectMapper = objectMapper;
    }

    @Override
    public LlmIntentResult classify(String normalizedText, SessionSnapshot context) {
        String raw;
        try {
            raw = intentParser.parse(normalizedText, intentNames(), history(context));
        } catch (RuntimeException e) {
            throw new ClassifierUnavailableException("LLM 호출 실패", e);
        }
        return toResult(raw);
    }

    LlmIntentResult toResult(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IntentParseException("LLM Intent 응답이 비어 있습니다.");
        }
        IntentResponse body;
        try {
            body = objectMapper.readValue(stripCodeFence(raw), IntentResponse.class);
        } catch (JsonProcessingException e) {
            throw new IntentParseException("LLM Intent 응답을 해석할 수 없습니다.", e);
        }
        if (body.intent() == null || body.confidence() == null) {
            throw new IntentParseException("LLM Intent 응답에 intent/confidence가 없습니다.");
        }
        IntentType intentType;
        try {
            intentType = IntentType.valueOf(body.intent().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IntentParseException("알 수 없는 intent: " + body.intent(), e);
        }
        return new LlmIntentResult(intentType, body.confidence(), toEntities(body.entities()));
    }

    private static Entities toEntities(EntityPayload payload) {
        if (payload == null) {
            return Entities.empty();
        }
        return new Entities(payload.club(), payload.score(), payload.hole(), payload.yardage(), lie(payload.lie()));
    }

    private static Lie lie(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return Arrays.stream(Lie.values())
                .filter(lie -> lie.name().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElse(null);
    }

    private static String stripCodeFence(String raw) {
        String trimmed = raw.trim();
        if (trimmed.startsWith("```")) {
            int firstLineEnd = trimmed.indexOf('\n');
            int closing = trimmed.lastIndexOf("```");
            if (firstLineEnd > 0 && closing > firstLineEnd) {
                return trimmed.substring(firstLineEnd + 1, closing).trim();
            }
        }
        return trimmed;
    }

    private static String intentNames() {
        return Arrays.stream(IntentType.values()).map(Enum::name).collect(Collectors.joining(", "));
    }

    private static String history(SessionSnapshot context) {
        if (context == null || context.turns().isEmpty()) {
            return "(none)";
        }
        int from = Math.max(0, context.turns().size() - HISTORY_TURNS);
        return context.turns().subList(from, context.turns().size()).stream()
                .map(OpenAiLlmAdapter::line)
                .collect(Collectors.joining("\n"));
    }

    private static String line(ConversationTurn turn) {
        return turn.role().name().toLowerCase(Locale.ROOT) + ": " + turn.content();
    }

    interface IntentParser {
        @SystemMessage("""
                You classify requests sent to a golf caddy assistant.
                Allowed intents: {{intents}}.
                Recent conversation:
                {{history}}
                Answer with a single JSON object and nothing else. Fields: "intent" (one allowed intent),
                "confidence" (number between 0 and 1) and "entities" (object with optional "club", "score",
                "hole", "yardage" and "lie"; lie is one of TEE, FAIRWAY, ROUGH, BUNKER, GREEN, FRINGE, HAZARD).
                """)
        String parse(@UserMessage String userMessage, @V("intents") String intents, @V("history") String history);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record IntentResponse(String intent, Double confidence, EntityPayload entities) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EntityPayload(String club, Integer score, Integer hole, Integer yardage, String lie) {}
}
