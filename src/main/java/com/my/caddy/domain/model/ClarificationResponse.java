package com.my.caddy.domain.model;

import com.my.caddy.domain.exception.ContractViolationException;

import java.util.List;
import java.util.Objects;

/**
 * 왜: 신뢰도가 부족할 때 사용자에게 보여줄 고정 문구와 최대 3개의 중복 없는 후보를 한 묶음으로 전달하기 위함.
 */
public record ClarificationResponse(String message, List<IntentSuggestion> suggestions, ClarificationTier tier) {

    public static final int MAX_SUGGESTIONS = 3;

    public ClarificationResponse {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(tier, "tier");
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        if (suggestions.size() > MAX_SUGGESTIONS) {
            throw new ContractViolationException("후보는 최대 3개까지 허용됩니다: " + suggestions.size());
        }
        long distinct = suggestions.stream().map(IntentSuggestion::intentType).distinct().count();
        if (distinct != suggestions.size()) {
            throw new ContractViolationException("같은 의도가 후보에 중복되었습니다.");
        }
    }

    public List<IntentType> suggestedTypes() {
        return suggestions.stream().map(IntentSuggestion::intentType).toList();
    }
}
