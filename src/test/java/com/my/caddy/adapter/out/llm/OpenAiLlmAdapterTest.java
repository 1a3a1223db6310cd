package com.my.caddy.adapter.out.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.caddy.domain.exception.ClassifierUnavailableException;
import com.my.caddy.domain.exception.IntentParseException;
import com.my.caddy.domain.model.ConversationTurn;
import com.my.caddy.domain.model.IntentType;
import com.my.caddy.domain.model.Lie;
import com.my.caddy.domain.model.LlmIntentResult;
import com.my.caddy.domain.model.Role;
import com.my.caddy.domain.model.SessionSnapshot;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiLlmAdapterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void parses_fenced_json_with_entities() {
        OpenAiLlmAdapter adapter = new OpenAiLlmAdapter((text, intents, history) -> "", objectMapper);

        LlmIntentResult result = adapter.toResult("""
                ```json
                {"intent":"club_adjustment","confidence":0.82,"entities":{"club":"7-Iron","yardage":150,"lie":"rough"}}
                ```
                """);

        assertThat(result.intentType()).isEqualTo(IntentType.CLUB_ADJUSTMENT);
        assertThat(result.confidence()).isEqualTo(0.82);
        assertThat(result.entities().club()).isEqualTo("7-iron");
        assertThat(result.entities().yardage()).isEqualTo(150);
        assertThat(result.entities().lie()).isEqualTo(Lie.ROUGH);
    }

    @Test
    void unknown_lie_is_dropped() {
        OpenAiLlmAdapter adapter = new OpenAiLlmAdapter((text, intents, history) -> "", objectMapper);

        LlmIntentResult result = adapter.toResult("{\"intent\":\"SHOT_RECOMMENDATION\",\"confidence\":0.9,"
                + "\"entities\":{\"lie\":\"cart path\"}}");

        assertThat(result.entities().lie()).isNull();
    }

    @Test
    void unknown_intent_is_parse_error() {
        OpenAiLlmAdapter adapter = new OpenAiLlmAdapter((text, intents, history) -> "", objectMapper);

        assertThatThrownBy(() -> adapter.toResult("{\"intent\":\"ORDER_BEER\",\"confidence\":0.9}"))
                .isInstanceOf(IntentParseException.class);
        assertThatThrownBy(() -> adapter.toResult("not json"))
                .isInstanceOf(IntentParseException.class);
        assertThatThrownBy(() -> adapter.toResult("{\"intent\":\"HELP_REQUEST\"}"))
                .isInstanceOf(IntentParseException.class);
    }

    @Test
    void transport_failure_becomes_classifier_unavailable() {
        OpenAiLlmAdapter adapter = new OpenAiLlmAdapter((text, intents, history) -> {
            throw new IllegalStateException("connection refused");
        }, objectMapper);

        assertThatThrownBy(() -> adapter.classify("show stats", SessionSnapshot.EMPTY))
                .isInstanceOf(ClassifierUnavailableException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void prompt_carries_intent_names_and_recent_history() {
        AtomicReference<String> intentsSeen = new AtomicReference<>();
        AtomicReference<String> historySeen = new AtomicReference<>();
        OpenAiLlmAdapter adapter = new OpenAiLlmAdapter((text, intents, history) -> {
            intentsSeen.set(intents);
            historySeen.set(history);
            return "{\"intent\":\"STATS_LOOKUP\",\"confidence\":0.9}";
        }, objectMapper);
        List<ConversationTurn> turns = new ArrayList<>();
        for (int i = 1; i <= 6; i++) {
            turns.add(new ConversationTurn(i % 2 == 1 ? Role.USER : Role.ASSISTANT, "t" + i, Instant.EPOCH));
        }

        adapter.classify("show stats", new SessionSnapshot(turns, null));

        assertThat(intentsSeen.get()).contains("SCORE_ENTRY", "PATTERN_QUERY");
        assertThat(historySeen.get()).isEqualTo("user: t3\nassistant: t4\nuser: t5\nassistant: t6");
    }
}
