package com.my.caddy.domain.clarification;

import com.my.caddy.domain.catalog.IntentCatalog;
import com.my.caddy.domain.model.ClarificationResponse;
import com.my.caddy.domain.model.ClarificationTier;
import com.my.caddy.domain.model.IntentSuggestion;
import com.my.caddy.domain.model.IntentType;
import com.my.caddy.domain.model.ScoredIntent;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 왜: 신뢰도가 낮을 때 보여줄 후보를 점수 순 최대 3개, 중복 없이 고르고 단계별 고정 문구를 붙이기 위함.
 */
public class ClarificationGenerator {

    /**
     * 온라인 경로에서 후보가 부족할 때 채우는 기본 의도.
     */
    public static final List<IntentType> ONLINE_DEFAULTS = List.of(
            IntentType.SHOT_RECOMMENDATION,
            IntentType.HELP_REQUEST,
            IntentType.STATS_LOOKUP
    );

    public static final List<IntentType> OFFLINE_DEFAULTS = List.of(
            IntentType.SCORE_ENTRY,
            IntentType.STATS_LOOKUP,
            IntentType.EQUIPMENT_INFO
    );

    private final IntentCatalog catalog;

    public ClarificationGenerator(IntentCatalog catalog) {
        this.catalog = catalog;
    }

    public ClarificationResponse generate(List<ScoredIntent> candidates, ClarificationTier tier) {
        return generate(candidates, tier, List.of());
    }

    /**
     * 후보를 점수 내림차순으로 정렬해 앞에서부터 채우고, 모자라면 {@code fillers} 순서대로 채운다.
     */
    public ClarificationResponse generate(List<ScoredIntent> candidates,
                                         ClarificationTier tier,
                                         List<IntentType> fillers) {
        Set<IntentType> chosen = new LinkedHashSet<>();
        candidates.stream()
                .filter(scored -> scored.score() > 0.0)
                .sorted(ScoredIntent.BY_SCORE_DESC)
                .map(ScoredIntent::type)
                .forEach(type -> addIfRoom(chosen, type));
        fillers.forEach(type -> addIfRoom(chosen, type));
        return response(tier.message(), tier, chosen);
    }

    /**
     * 오프라인에서 이해하지 못했거나 온라인 전용 기능을 요청했을 때 우선순위 오프라인 메뉴를 제시한다.
     */
    public ClarificationResponse offlineMenu(ClarificationTier tier, String message) {
        Set<IntentType> chosen = new LinkedHashSet<>();
        IntentCatalog.OFFLINE_PRIORITY.forEach(type -> addIfRoom(chosen, type));
        return response(message, tier, chosen);
    }

    private ClarificationResponse response(String message, ClarificationTier tier, Set<IntentType> chosen) {
        List<IntentSuggestion> suggestions = new ArrayList<>(chosen.size());
        chosen.forEach(type -> suggestions.add(catalog.suggestion(type)));
        return new ClarificationResponse(message, suggestions, tier);
    }

    private static void addIfRoom(Set<IntentType> chosen, IntentType type) {
        if (chosen.size() < ClarificationResponse.MAX_SUGGESTIONS) {
            chosen.add(type);
        }
    }
}
