package com.my.caddy.domain.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 왜: 정규화 결과와 적용된 변경 내역을 함께 돌려주어 분류 단계와 디버깅이 같은 근거를 보도록 하기 위함.
 */
public record NormalizationResult(String originalText, String normalizedText, List<Modification> modifications) {

    public NormalizationResult {
        Objects.requireNonNull(originalText, "originalText");
        Objects.requireNonNull(normalizedText, "normalizedText");
        modifications = modifications == null ? List.of() : List.copyOf(modifications);
    }

    public static NormalizationResult unchanged(String text) {
        return new NormalizationResult(text, text, List.of());
    }

    public boolean wasModified() {
        return !modifications.isEmpty();
    }

    public List<String> appliedModifications() {
        return modifications.stream().map(Modification::describe).toList();
    }

    public record Modification(ModificationType type, String original, String replacement) {
        public Modification {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(original, "original");
            Objects.requireNonNull(replacement, "replacement");
        }

        public String describe() {
            return type.name().toLowerCase(Locale.ROOT) + ": '" + original + "' -> '" + replacement + "'";
        }
    }
}
