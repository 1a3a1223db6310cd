package com.my.caddy.domain.offline;

import com.my.caddy.domain.model.IntentType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 의도별 키워드와 가중치. 점수 = 텍스트에 포함된 키워드 가중치 합 / 해당 의도 전체 가중치 합.
 */
public final class KeywordTable {

    private final Map<IntentType, Map<String, Double>> keywords;

    private KeywordTable(Map<IntentType, Map<String, Double>> keywords) {
        this.keywords = keywords;
    }

    public static KeywordTable of(Map<IntentType, Map<String, Double>> source) {
        Map<IntentType, Map<String, Double>> copy = new EnumMap<>(IntentType.class);
        source.forEach((type, words) -> {
            Map<String, Double> ordered = new LinkedHashMap<>();
            words.forEach((word, weight) -> {
                if (weight == null || !(weight > 0.0)) {
                    throw new IllegalArgumentException("키워드 가중치는 양수여야 합니다: " + type + "/" + word);
                }
                ordered.put(word.toLowerCase(Locale.ROOT), weight);
            });
            copy.put(type, Collections.unmodifiableMap(ordered));
        });
        return new KeywordTable(Collections.unmodifiableMap(copy));
    }

    public static KeywordTable defaults() {
        Map<IntentType, Map<String, Double>> table = new EnumMap<>(IntentType.class);
        table.put(IntentType.CLUB_ADJUSTMENT, weights(
                "adjust", 1.0, "distance", 0.8, "yardage", 0.8, "carry", 0.7, "club", 0.5));
        table.put(IntentType.RECOVERY_CHECK, weights(
                "recovery", 1.0, "sore", 0.8, "tired", 0.7, "sleep", 0.6));
        table.put(IntentType.SHOT_RECOMMENDATION, weights(
                "recommend", 1.0, "what club", 1.0, "which club", 1.0, "advice", 0.9, "shot", 0.6));
        table.put(IntentType.SCORE_ENTRY, weights(
                "score", 1.0, "enter", 0.8, "record", 0.8, "birdie", 0.6, "bogey", 0.6, "par", 0.5, "hole", 0.5));
        table.put(IntentType.PATTERN_QUERY, weights(
                "pattern", 1.0, "miss", 0.9, "tendency", 0.9, "slice", 0.7, "hook", 0.7));
        table.put(IntentType.DRILL_REQUEST, weights(
                "drill", 1.0, "practice", 0.9, "exercise", 0.8, "training", 0.8));
        table.put(IntentType.WEATHER_CHECK, weights(
                "weather", 1.0, "wind", 0.9, "forecast", 0.9, "rain", 0.8));
        table.put(IntentType.STATS_LOOKUP, weights(
                "stats", 1.0, "statistics", 1.0, "performance", 0.8, "average", 0.7, "handicap", 0.7, "summary", 0.6));
        table.put(IntentType.ROUND_START, weights(
                "new round", 1.0, "start", 0.9, "tee off", 0.9, "begin", 0.8, "first hole", 0.7));
        table.put(IntentType.ROUND_END, weights(
                "end round", 1.0, "finish", 0.9, "complete", 0.8, "last hole", 0.8, "done", 0.7));
        table.put(IntentType.EQUIPMENT_INFO, weights(
                "bag", 1.0, "my bag", 0.9, "what's in", 0.8, "equipment", 0.6));
        table.put(IntentType.COURSE_INFO, weights(
                "course", 1.0, "layout", 0.9, "map", 0.8, "hole", 0.6));
        table.put(IntentType.SETTINGS_CHANGE, weights(
                "settings", 1.0, "preferences", 0.9, "options", 0.8, "configure", 0.8, "setup", 0.7));
        table.put(IntentType.HELP_REQUEST, weights(
                "help", 1.0, "how to", 0.9, "instructions", 0.8, "guide", 0.7, "tutorial", 0.7));
        table.put(IntentType.FEEDBACK, weights(
                "feedback", 1.0, "bug", 0.8, "report", 0.8, "suggestion", 0.8));
        table.put(IntentType.BAILOUT_QUERY, weights(
                "bailout", 1.0, "bail out", 1.0, "safe side", 0.8, "trouble", 0.7));
        table.put(IntentType.READINESS_CHECK, weights(
                "readiness", 1.0, "ready", 0.8, "warm up", 0.7));
        return of(table);
    }

    public double score(IntentType type, String normalizedText) {
        Map<String, Double> words = keywords.get(type);
        if (words == null || words.isEmpty() || normalizedText == null || normalizedText.isEmpty()) {
            return 0.0;
        }
        String text = normalizedText.toLowerCase(Locale.ROOT);
        double total = 0.0;
        double matched = 0.0;
        for (Map.Entry<String, Double> entry : words.entrySet()) {
            total += entry.getValue();
            if (text.contains(entry.getKey())) {
                matched += entry.getValue();
            }
        }
        return matched / total;
    }

    private static Map<String, Double> weights(Object... pairs) {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], (Double) pairs[i + 1]);
        }
        return map;
    }
}
