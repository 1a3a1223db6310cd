package com.my.caddy.domain.model;

import java.time.Duration;

/**
 * 입력 경로. 분류기 타임아웃 예산을 고르는 데 쓰인다.
 */
public enum InputModality {
    TEXT,
    VOICE;

    public Duration budget(Duration textBudget, Duration voiceBudget) {
        return this == VOICE ? voiceBudget : textBudget;
    }
}
