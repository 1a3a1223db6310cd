package com.my.caddy.domain.model;

import java.util.Collections;
import java.util.Locale;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 왜: 입력에서 뽑아낸 선택적 값들을 타입이 있는 희소 구조로 고정한다. 값이 없으면 오류가 아니라 단순히 비어 있다.
 *
 * <p>범위를 벗어난 값(1~18 밖의 홀, 0 이하 거리/스코어)은 예외 없이 버린다. LLM 출력을 그대로 받아도 안전해야 하기 때문이다.
 */
public record Entities(String club, Integer score, Integer holeNumber, Integer yardage, Lie lie) {

    private static final Entities EMPTY = new Entities(null, null, null, null, null);

    public Entities {
        club = club == null || club.isBlank() ? null : club.trim().toLowerCase(Locale.ROOT);
        score = score != null && score > 0 ? score : null;
        holeNumber = holeNumber != null && holeNumber >= 1 && holeNumber <= 18 ? holeNumber : null;
        yardage = yardage != null && yardage > 0 ? yardage : null;
    }

    public static Entities empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return club == null && score == null && holeNumber == null && yardage == null && lie == null;
    }

    /**
     * 이 객체의 값을 우선하고 비어 있는 필드만 {@code fallback}으로 채운다.
     */
    public Entities mergedWith(Entities fallback) {
        if (fallback == null) {
            return this;
        }
        return new Entities(
                club != null ? club : fallback.club(),
                score != null ? score : fallback.score(),
                holeNumber != null ? holeNumber : fallback.holeNumber(),
                yardage != null ? yardage : fallback.yardage(),
                lie != null ? lie : fallback.lie()
        );
    }

    public SortedMap<String, Object> toParameters() {
        SortedMap<String, Object> parameters = new TreeMap<>();
        if (club != null) {
            parameters.put("club", club);
        }
        if (holeNumber != null) {
            parameters.put("hole", holeNumber);
        }
        if (lie != null) {
            parameters.put("lie", lie.name().toLowerCase(Locale.ROOT));
        }
        if (score != null) {
            parameters.put("score", score);
        }
        if (yardage != null) {
            parameters.put("yardage", yardage);
        }
        return Collections.unmodifiableSortedMap(parameters);
    }
}
