package com.my.caddy.domain.model;

import com.my.caddy.domain.exception.ContractViolationException;

import java.util.Objects;

/**
 * 왜: 분류기가 만든 의도를 불변 값으로 고정하여 오케스트레이터가 같은 입력에 같은 결정을 내리도록 하기 위함.
 */
public record Intent(String id, IntentType type, double confidence, Entities entities, String rawInput) {

    public Intent {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(rawInput, "rawInput");
        entities = entities == null ? Entities.empty() : entities;
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new ContractViolationException("의도 신뢰도는 0과 1 사이여야 합니다: " + confidence);
        }
    }
}
