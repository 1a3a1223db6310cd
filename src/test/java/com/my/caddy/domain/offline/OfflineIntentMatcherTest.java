package com.my.caddy.domain.offline;

import com.my.caddy.domain.catalog.IntentCatalog;
import com.my.caddy.domain.clarification.ClarificationGenerator;
import com.my.caddy.domain.model.ClarificationTier;
import com.my.caddy.domain.model.IntentType;
import com.my.caddy.domain.model.ScoredIntent;
import com.my.caddy.domain.normalizer.EntityExtractor;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class OfflineIntentMatcherTest {

    private final IntentCatalog catalog = new IntentCatalog();

    @Test
    void single_strong_score_is_a_direct_match() {
        OfflineIntentMatcher matcher = matcher(KeywordTable.of(keywords(IntentType.SCORE_ENTRY, "score", 3.0, "card", 1.0)));

        OfflineResult result = matcher.resolve("i-1", "Score hole 4", "score hole 4");

        assertThat(result).isInstanceOfSatisfying(OfflineResult.Match.class, match -> {
            assertThat(match.intent().type()).isEqualTo(IntentType.SCORE_ENTRY);
            assertThat(match.intent().confidence()).isCloseTo(0.75, within(1e-9));
            assertThat(match.intent().entities().holeNumber()).isEqualTo(4);
            assertThat(match.intent().id()).isEqualTo("i-1");
        });
    }

    @Test
    void weak_score_asks_for_clarification_with_at_most_three_suggestions() {
        Map<IntentType, Map<String, Double>> source = new EnumMap<>(IntentType.class);
        source.putAll(keywords(IntentType.STATS_LOOKUP, "stats", 0.45, "numbers", 0.55));
        source.putAll(keywords(IntentType.SCORE_ENTRY, "stats", 0.40, "score", 0.60));
        source.putAll(keywords(IntentType.EQUIPMENT_INFO, "stats", 0.30, "bag", 0.70));
        source.putAll(keywords(IntentType.SETTINGS_CHANGE, "stats", 0.20, "settings", 0.80));
        OfflineIntentMatcher matcher = matcher(KeywordTable.of(source));

        OfflineResult result = matcher.resolve("i-2", "stats", "stats");

        assertThat(result).isInstanceOfSatisfying(OfflineResult.Clarify.class, clarify -> {
            assertThat(clarify.bestScore()).isCloseTo(0.45, within(1e-9));
            assertThat(clarify.clarification().tier()).isEqualTo(ClarificationTier.OFFLINE_WEAK);
            assertThat(clarify.clarification().suggestedTypes())
                    .containsExactly(IntentType.STATS_LOOKUP, IntentType.SCORE_ENTRY, IntentType.EQUIPMENT_INFO);
        });
    }

    @Test
    void two_strong_scores_are_not_a_single_match() {
        Map<IntentType, Map<String, Double>> source = new EnumMap<>(IntentType.class);
        source.putAll(keywords(IntentType.SCORE_ENTRY, "score", 1.0));
        source.putAll(keywords(IntentType.STATS_LOOKUP, "stats", 1.0));
        OfflineIntentMatcher matcher = matcher(KeywordTable.of(source));

        OfflineResult result = matcher.resolve("i-3", "score stats", "score stats");

        assertThat(result).isInstanceOf(OfflineResult.Clarify.class);
    }

    @Test
    void zero_score_everywhere_is_no_match() {
        OfflineIntentMatcher matcher = matcher(KeywordTable.of(keywords(IntentType.SCORE_ENTRY, "score", 1.0)));

        OfflineResult result = matcher.resolve("i-4", "banana", "banana");

        assertThat(result).isEqualTo(new OfflineResult.NoMatch(ClarificationTier.OFFLINE_NO_MATCH.message()));
    }

    @Test
    void online_only_intent_reports_its_limitation() {
        OfflineIntentMatcher matcher = matcher(KeywordTable.defaults());

        OfflineResult result = matcher.resolve("i-5", "weather", "what's the weather forecast");

        assertThat(result).isInstanceOfSatisfying(OfflineResult.RequiresOnline.class, requiresOnline -> {
            assertThat(requiresOnline.intentType()).isEqualTo(IntentType.WEATHER_CHECK);
            assertThat(requiresOnline.message()).contains("internet connection");
        });
    }

    @Test
    void whats_in_my_bag_matches_equipment_offline() {
        OfflineIntentMatcher matcher = matcher(KeywordTable.defaults());

        List<ScoredIntent> scores = matcher.match("what's in my bag");
        OfflineResult result = matcher.resolve("i-6", "What's in my bag", "what's in my bag");

        assertThat(scores.get(0).type()).isEqualTo(IntentType.EQUIPMENT_INFO);
        assertThat(scores.get(0).score()).isGreaterThanOrEqualTo(0.7);
        assertThat(result).isInstanceOfSatisfying(OfflineResult.Match.class,
                match -> assertThat(match.intent().type()).isEqualTo(IntentType.EQUIPMENT_INFO));
    }

    @Test
    void match_only_scores_offline_capable_intents() {
        OfflineIntentMatcher matcher = matcher(KeywordTable.defaults());

        assertThat(matcher.match("weather recovery")).isEmpty();
        assertThat(matcher.scoreAll("weather recovery")).extracting(ScoredIntent::type)
                .containsExactlyInAnyOrder(IntentType.WEATHER_CHECK, IntentType.RECOVERY_CHECK);
    }

    @Test
    void keyword_weights_must_be_positive() {
        assertThatThrownBy(() -> KeywordTable.of(keywords(IntentType.FEEDBACK, "bug", 0.0)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private OfflineIntentMatcher matcher(KeywordTable table) {
        return new OfflineIntentMatcher(table, catalog, new ClarificationGenerator(catalog), new EntityExtractor(),
                OfflineIntentMatcher.DEFAULT_STRONG_THRESHOLD, OfflineIntentMatcher.DEFAULT_WEAK_THRESHOLD);
    }

    private static Map<IntentType, Map<String, Double>> keywords(IntentType type, Object... pairs) {
        Map<String, Double> weights = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            weights.put((String) pairs[i], (Double) pairs[i + 1]);
        }
        Map<IntentType, Map<String, Double>> source = new EnumMap<>(IntentType.class);
        source.put(type, weights);
        return source;
    }

}
