package com.my.caddy.domain.classifier;

import com.my.caddy.domain.catalog.IntentCatalog;
import com.my.caddy.domain.clarification.ClarificationGenerator;
import com.my.caddy.domain.exception.ClassifierUnavailableException;
import com.my.caddy.domain.model.ClarificationTier;
import com.my.caddy.domain.model.ClassificationSource;
import com.my.caddy.domain.model.ClassificationVerdict;
import com.my.caddy.domain.model.Entities;
import com.my.caddy.domain.model.InputModality;
import com.my.caddy.domain.model.IntentType;
import com.my.caddy.domain.model.LlmIntentResult;
import com.my.caddy.domain.model.SessionSnapshot;
import com.my.caddy.domain.normalizer.EntityExtractor;
import com.my.caddy.domain.offline.KeywordTable;
import com.my.caddy.domain.offline.OfflineIntentMatcher;
import com.my.caddy.domain.port.out.LlmPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IntentClassifierTest {

    private final IntentCatalog catalog = new IntentCatalog();
    private LlmPort llmPort;
    private ExecutorService executor;
    private IntentClassifier classifier;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        executor = Executors.newCachedThreadPool();
        classifier = classifier(ClassifierPolicy.defaults());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void high_confidence_routes_with_merged_entities() {
        when(llmPort.classify(anyString(), any())).thenReturn(
                new LlmIntentResult(IntentType.SCORE_ENTRY, 0.9, new Entities(null, 4, null, null, null)));

        ClassificationVerdict verdict = classifier.classify(online("enter score for hole 5"));

        assertThat(verdict).isInstanceOfSatisfying(ClassificationVerdict.Route.class, route -> {
            assertThat(route.source()).isEqualTo(ClassificationSource.ONLINE);
            assertThat(route.intent().type()).isEqualTo(IntentType.SCORE_ENTRY);
            assertThat(route.intent().entities().holeNumber()).isEqualTo(5);
            assertThat(route.intent().entities().score()).isEqualTo(4);
        });
    }

    @Test
    void route_threshold_is_inclusive() {
        when(llmPort.classify(anyString(), any())).thenReturn(new LlmIntentResult(IntentType.STATS_LOOKUP, 0.75, null));

        assertThat(classifier.classify(online("show stats"))).isInstanceOf(ClassificationVerdict.Route.class);
    }

    @Test
    void middle_confidence_asks_for_confirmation() {
        when(llmPort.classify(anyString(), any())).thenReturn(new LlmIntentResult(IntentType.SCORE_ENTRY, 0.6, null));

        ClassificationVerdict verdict = classifier.classify(online("enter score for hole 5"));

        assertThat(verdict).isInstanceOfSatisfying(ClassificationVerdict.Confirm.class,
                confirm -> assertThat(confirm.message()).isEqualTo("Did you want to enter a score? (on hole 5)"));
    }

    @Test
    void confirm_threshold_is_inclusive() {
        when(llmPort.classify(anyString(), any())).thenReturn(new LlmIntentResult(IntentType.STATS_LOOKUP, 0.50, null));

        ClassificationVerdict verdict = classifier.classify(online("show stats"));

        assertThat(verdict).isInstanceOfSatisfying(ClassificationVerdict.Confirm.class,
                confirm -> assertThat(confirm.message()).isEqualTo("Did you want to look up your stats?"));
    }

    @Test
    void near_miss_clarification_lists_classifier_guess_first() {
        when(llmPort.classify(anyString(), any())).thenReturn(new LlmIntentResult(IntentType.DRILL_REQUEST, 0.45, null));

        ClassificationVerdict verdict = classifier.classify(online("something about practice"));

        assertThat(verdict).isInstanceOfSatisfying(ClassificationVerdict.Clarify.class, clarify -> {
            assertThat(clarify.clarification().tier()).isEqualTo(ClarificationTier.NEAR_MISS);
            assertThat(clarify.clarification().suggestedTypes()).first().isEqualTo(IntentType.DRILL_REQUEST);
            assertThat(clarify.clarification().suggestions()).hasSizeLessThanOrEqualTo(3);
        });
    }

    @Test
    void very_low_confidence_uses_unclear_wording_and_default_suggestions() {
        when(llmPort.classify(anyString(), any())).thenReturn(new LlmIntentResult(IntentType.FEEDBACK, 0.1, null));

        ClassificationVerdict verdict = classifier.classify(online("zzz"));

        assertThat(verdict).isInstanceOfSatisfying(ClassificationVerdict.Clarify.class, clarify -> {
            assertThat(clarify.clarification().tier()).isEqualTo(ClarificationTier.UNCLEAR);
            assertThat(clarify.clarification().suggestedTypes())
                    .containsExactlyElementsOf(ClarificationGenerator.ONLINE_DEFAULTS);
        });
    }

    @Test
    void unavailable_classifier_falls_back_to_offline_matcher() {
        when(llmPort.classify(anyString(), any())).thenThrow(new ClassifierUnavailableException("down"));

        ClassificationVerdict verdict = classifier.classify(online("what's in my bag"));

        assertThat(verdict).isInstanceOfSatisfying(ClassificationVerdict.Route.class, route -> {
            assertThat(route.source()).isEqualTo(ClassificationSource.OFFLINE);
            assertThat(route.intent().type()).isEqualTo(IntentType.EQUIPMENT_INFO);
        });
    }

    @Test
    void out_of_range_confidence_is_treated_as_unavailable() {
        when(llmPort.classify(anyString(), any())).thenReturn(new LlmIntentResult(IntentType.STATS_LOOKUP, 1.5, null));

        ClassificationVerdict verdict = classifier.classify(online("what's in my bag"));

        assertThat(verdict.source()).isEqualTo(ClassificationSource.OFFLINE);
    }

    @Test
    void slow_classifier_times_out_and_falls_back_once() {
        classifier = classifier(new ClassifierPolicy(0.75, 0.50, Duration.ofMillis(100), Duration.ofMillis(100)));
        when(llmPort.classify(anyString(), any())).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return new LlmIntentResult(IntentType.SCORE_ENTRY, 0.99, null);
        });

        long started = System.nanoTime();
        ClassificationVerdict verdict = classifier.classify(online("what's in my bag"));
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertThat(verdict).isInstanceOfSatisfying(ClassificationVerdict.Route.class, route -> {
            assertThat(route.source()).isEqualTo(ClassificationSource.OFFLINE);
            assertThat(route.intent().type()).isEqualTo(IntentType.EQUIPMENT_INFO);
        });
        assertThat(elapsedMillis).isLessThan(1_500);
    }

    @Test
    void no_network_never_calls_the_classifier() {
        ClassificationVerdict verdict = classifier.classify(new ClassificationInput("evt-1", "What's in my bag",
                "what's in my bag", InputModality.VOICE, false, SessionSnapshot.EMPTY));

        verify(llmPort, never()).classify(anyString(), any());
        assertThat(verdict).isInstanceOfSatisfying(ClassificationVerdict.Route.class,
                route -> assertThat(route.intent().type()).isEqualTo(IntentType.EQUIPMENT_INFO));
    }

    @Test
    void offline_request_for_online_feature_offers_offline_menu() {
        ClassificationVerdict verdict = classifier.classify(new ClassificationInput("evt-2", "weather?",
                "what's the weather forecast", InputModality.TEXT, false, SessionSnapshot.EMPTY));

        assertThat(verdict).isInstanceOfSatisfying(ClassificationVerdict.Clarify.class, clarify -> {
            assertThat(clarify.bestGuess().type()).isEqualTo(IntentType.WEATHER_CHECK);
            assertThat(clarify.clarification().tier()).isEqualTo(ClarificationTier.REQUIRES_ONLINE);
            assertThat(clarify.clarification().message()).startsWith("Weather data needs an internet connection");
            assertThat(clarify.clarification().suggestedTypes())
                    .containsExactly(IntentType.SCORE_ENTRY, IntentType.STATS_LOOKUP, IntentType.EQUIPMENT_INFO);
        });
    }

    @Test
    void blank_input_asks_to_say_something() {
        ClassificationVerdict verdict = classifier.classify(online(""));

        verify(llmPort, never()).classify(anyString(), any());
        assertThat(verdict).isInstanceOfSatisfying(ClassificationVerdict.Clarify.class, clarify -> {
            assertThat(clarify.clarification().tier()).isEqualTo(ClarificationTier.EMPTY_INPUT);
            assertThat(clarify.bestGuess().confidence()).isZero();
        });
    }

    private IntentClassifier classifier(ClassifierPolicy policy) {
        ClarificationGenerator generator = new ClarificationGenerator(catalog);
        EntityExtractor extractor = new EntityExtractor();
        OfflineIntentMatcher matcher = new OfflineIntentMatcher(KeywordTable.defaults(), catalog, generator, extractor,
                OfflineIntentMatcher.DEFAULT_STRONG_THRESHOLD, OfflineIntentMatcher.DEFAULT_WEAK_THRESHOLD);
        return new IntentClassifier(llmPort, matcher, generator, extractor, catalog, policy, executor);
    }

    private static ClassificationInput online(String normalizedText) {
        return new ClassificationInput("evt", normalizedText, normalizedText, InputModality.TEXT, true,
                SessionSnapshot.EMPTY);
    }
}
