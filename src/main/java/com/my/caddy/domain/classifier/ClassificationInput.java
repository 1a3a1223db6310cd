package com.my.caddy.domain.classifier;

import com.my.caddy.domain.model.InputModality;
import com.my.caddy.domain.model.SessionSnapshot;

import java.util.Objects;

/**
 * 분류기 한 번 호출에 필요한 값. {@code intentId}는 결과 의도의 ID가 된다.
 */
public record ClassificationInput(String intentId,
                                  String rawInput,
                                  String normalizedText,
                                  InputModality modality,
                                  boolean networkAvailable,
                                  SessionSnapshot context) {
    public ClassificationInput {
        Objects.requireNonNull(intentId, "intentId");
        Objects.requireNonNull(rawInput, "rawInput");
        Objects.requireNonNull(normalizedText, "normalizedText");
        Objects.requireNonNull(modality, "modality");
        context = context == null ? SessionSnapshot.EMPTY : context;
    }
}
