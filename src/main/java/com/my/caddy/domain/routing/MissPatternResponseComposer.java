package com.my.caddy.domain.routing;

import com.my.caddy.domain.memory.MissPatternStore;
import com.my.caddy.domain.model.Intent;
import com.my.caddy.domain.model.IntentType;
import com.my.caddy.domain.model.MissPattern;
import com.my.caddy.domain.model.PatternFilter;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * 왜: 패턴 질문에 화면 이동 대신 저장된 미스 이벤트로 계산한 요약을 바로 답하기 위함. 다른 의도는 {@code fallback}에 맡긴다.
 */
public class MissPatternResponseComposer implements ResponseComposer {

    private final ResponseComposer fallback;
    private final MissPatternStore patternStore;
    private final Instant now;

    public MissPatternResponseComposer(ResponseComposer fallback, MissPatternStore patternStore, Instant now) {
        this.fallback = fallback;
        this.patternStore = patternStore;
        this.now = now;
    }

    @Override
    public String compose(Intent intent) {
        if (intent.type() != IntentType.PATTERN_QUERY) {
            return fallback.compose(intent);
        }
        String club = intent.entities().club();
        PatternFilter filter = patternStore.filter(club, false);
        List<MissPattern> patterns = patternStore.patterns(filter, now);
        return summarize(club, patterns);
    }

    static String summarize(String club, List<MissPattern> patterns) {
        String scope = club == null ? "" : " with your " + club;
        if (patterns.isEmpty()) {
            return "I don't have enough recent shots" + scope + " to spot a pattern yet. Log a few more and ask again.";
        }
        MissPattern main = patterns.get(0);
        StringBuilder answer = new StringBuilder("Based on your recent shots")
                .append(scope)
                .append(", your main miss is a ")
                .append(describe(main))
                .append('.');
        if (patterns.size() > 1) {
            answer.append(" Your next most common miss is a ").append(describe(patterns.get(1))).append('.');
        }
        return answer.toString();
    }

    private static String describe(MissPattern pattern) {
        return pattern.direction().name().toLowerCase(Locale.ROOT)
                + " (" + pattern.frequency() + " shots, "
                + Math.round(pattern.confidence() * 100) + "% confidence)";
    }
}
