package com.my.caddy.domain.offline;

import com.my.caddy.domain.catalog.IntentCatalog;
import com.my.caddy.domain.clarification.ClarificationGenerator;
import com.my.caddy.domain.model.ClarificationResponse;
import com.my.caddy.domain.model.ClarificationTier;
import com.my.caddy.domain.model.Intent;
import com.my.caddy.domain.model.IntentType;
import com.my.caddy.domain.model.ScoredIntent;
import com.my.caddy.domain.normalizer.EntityExtractor;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * 왜: 원격 분류기를 쓸 수 없을 때 키워드 점수만으로 같은 입력에 같은 결과를 내는 대체 분류기를 제공하기 위함.
 *
 * <p>강한 임계값 이상 후보가 정확히 하나면 {@code Match}, 최고 점수가 약한 임계값 이상이면 상위 3개로 {@code Clarify},
 * 그 외에는 온라인 전용 의도가 약한 임계값을 넘었는지에 따라 {@code RequiresOnline} 또는 {@code NoMatch}.
 */
public class OfflineIntentMatcher {

    public static final double DEFAULT_STRONG_THRESHOLD = 0.70;
    public static final double DEFAULT_WEAK_THRESHOLD = 0.40;

    private final KeywordTable keywordTable;
    private final IntentCatalog catalog;
    private final ClarificationGenerator clarificationGenerator;
    private final EntityExtractor entityExtractor;
    private final double strongThreshold;
    private final double weakThreshold;

    public OfflineIntentMatcher(KeywordTable keywordTable,
                                IntentCatalog catalog,
                                ClarificationGenerator clarificationGenerator,
                                EntityExtractor entityExtractor,
                                double strongThreshold,
                                double weakThreshold) {
        this.keywordTable = keywordTable;
        this.catalog = catalog;
        this.clarificationGenerator = clarificationGenerator;
        this.entityExtractor = entityExtractor;
        this.strongThreshold = strongThreshold;
        this.weakThreshold = weakThreshold;
    }

    /**
     * 오프라인에서 처리 가능한 의도만 점수화한다. 0점은 빠진다.
     */
    public List<ScoredIntent> match(String normalizedText) {
        return score(normalizedText, catalog::isOfflineAvailable);
    }

    public List<ScoredIntent> scoreAll(String normalizedText) {
        return score(normalizedText, type -> true);
    }

    public OfflineResult resolve(String intentId, String rawInput, String normalizedText) {
        List<ScoredIntent> matches = match(normalizedText);
        List<ScoredIntent> strong = matches.stream()
                .filter(scored -> scored.score() >= strongThreshold)
                .toList();
        if (strong.size() == 1) {
            ScoredIntent best = strong.get(0);
            Intent intent = new Intent(intentId, best.type(), Math.min(1.0, best.score()),
                    entityExtractor.extract(normalizedText), rawInput);
            return new OfflineResult.Match(intent);
        }
        if (!matches.isEmpty() && matches.get(0).score() >= weakThreshold) {
            ClarificationResponse clarification = clarificationGenerator.generate(matches, ClarificationTier.OFFLINE_WEAK);
            return new OfflineResult.Clarify(clarification, matches.get(0).score());
        }
        Optional<ScoredIntent> onlineOnly = score(normalizedText, type -> !catalog.isOfflineAvailable(type)).stream()
                .filter(scored -> scored.score() >= weakThreshold)
                .findFirst();
        if (onlineOnly.isPresent()) {
            IntentType type = onlineOnly.get().type();
            return new OfflineResult.RequiresOnline(type, catalog.definition(type).offlineLimitation());
        }
        return new OfflineResult.NoMatch(ClarificationTier.OFFLINE_NO_MATCH.message());
    }

    public double strongThreshold() {
        return strongThreshold;
    }

    public double weakThreshold() {
        return weakThreshold;
    }

    private List<ScoredIntent> score(String normalizedText, Predicate<IntentType> candidates) {
        return Arrays.stream(IntentType.values())
                .filter(candidates)
                .map(type -> new ScoredIntent(type, keywordTable.score(type, normalizedText)))
                .filter(scored -> scored.score() > 0.0)
                .sorted(ScoredIntent.BY_SCORE_DESC)
                .toList();
    }
}
