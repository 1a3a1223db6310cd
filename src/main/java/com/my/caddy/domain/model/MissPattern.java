package com.my.caddy.domain.model;

import com.my.caddy.domain.exception.ContractViolationException;

import java.time.Instant;
import java.util.Objects;

/**
 * 왜: 이벤트에서 파생되는 구체화 뷰를 표현한다. 사용자가 직접 수정하지 않고 재집계로만 교체된다.
 */
public record MissPattern(
        String id,
        MissDirection direction,
        int frequency,
        double confidence,
        Instant lastOccurrence,
        String clubId,
        PressureContext pressureContext
) {
    public MissPattern {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(lastOccurrence, "lastOccurrence");
        if (frequency <= 0) {
            throw new ContractViolationException("패턴 빈도는 양수여야 합니다: " + frequency);
        }
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new ContractViolationException("패턴 신뢰도는 0과 1 사이여야 합니다: " + confidence);
        }
    }

    public MissPattern withConfidence(double newConfidence) {
        return new MissPattern(id, direction, frequency, newConfidence, lastOccurrence, clubId, pressureContext);
    }
}
