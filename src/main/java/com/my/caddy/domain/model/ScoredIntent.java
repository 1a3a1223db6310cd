package com.my.caddy.domain.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * 매처가 계산한 의도별 점수.
 */
public record ScoredIntent(IntentType type, double score) {

    /**
     * 점수 내림차순, 동점이면 enum 선언 순서.
     */
    public static final Comparator<ScoredIntent> BY_SCORE_DESC = Comparator
            .comparingDouble(ScoredIntent::score).reversed()
            .thenComparing(scored -> scored.type().ordinal());

    public ScoredIntent {
        Objects.requireNonNull(type, "type");
    }
}
