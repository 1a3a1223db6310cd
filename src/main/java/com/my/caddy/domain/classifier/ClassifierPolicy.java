package com.my.caddy.domain.classifier;

import com.my.caddy.domain.exception.ContractViolationException;
import com.my.caddy.domain.model.InputModality;

import java.time.Duration;
import java.util.Objects;

/**
 * 온라인 분류 임계값과 입력 경로별 타임아웃 예산.
 */
public record ClassifierPolicy(double routeThreshold,
                               double confirmThreshold,
                               Duration textTimeout,
                               Duration voiceTimeout) {

    public static final double DEFAULT_ROUTE_THRESHOLD = 0.75;
    public static final double DEFAULT_CONFIRM_THRESHOLD = 0.50;
    /**
     * 이 값 이상이면 LLM이 고른 의도를 되묻기 후보에 넣고 NEAR_MISS 문구를 쓴다.
     */
    public static final double NEAR_MISS_FLOOR = 0.30;

    public ClassifierPolicy {
        Objects.requireNonNull(textTimeout, "textTimeout");
        Objects.requireNonNull(voiceTimeout, "voiceTimeout");
        if (confirmThreshold < 0.0 || routeThreshold > 1.0 || confirmThreshold > routeThreshold) {
            throw new ContractViolationException(
                    "임계값은 0 <= confirm <= route <= 1 이어야 합니다: " + confirmThreshold + ", " + routeThreshold);
        }
        if (textTimeout.isNegative() || textTimeout.isZero() || voiceTimeout.isNegative() || voiceTimeout.isZero()) {
            throw new ContractViolationException("타임아웃 예산은 양수여야 합니다.");
        }
    }

    public static ClassifierPolicy defaults() {
        return new ClassifierPolicy(DEFAULT_ROUTE_THRESHOLD, DEFAULT_CONFIRM_THRESHOLD,
                Duration.ofMillis(3000), Duration.ofMillis(4500));
    }

    public Duration budget(InputModality modality) {
        return modality.budget(textTimeout, voiceTimeout);
    }
}
