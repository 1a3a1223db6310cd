package com.my.caddy.domain.classifier;

import com.my.caddy.domain.catalog.IntentCatalog;
import com.my.caddy.domain.clarification.ClarificationGenerator;
import com.my.caddy.domain.exception.IntentParseException;
import com.my.caddy.domain.model.ClarificationResponse;
import com.my.caddy.domain.model.ClarificationTier;
import com.my.caddy.domain.model.ClassificationSource;
import com.my.caddy.domain.model.ClassificationVerdict;
import com.my.caddy.domain.model.Entities;
import com.my.caddy.domain.model.Intent;
import com.my.caddy.domain.model.IntentType;
import com.my.caddy.domain.model.LlmIntentResult;
import com.my.caddy.domain.model.ScoredIntent;
import com.my.caddy.domain.normalizer.EntityExtractor;
import com.my.caddy.domain.offline.OfflineIntentMatcher;
import com.my.caddy.domain.offline.OfflineResult;
import com.my.caddy.domain.port.out.LlmPort;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * 왜: 외부 LLM 결과를 임계값으로 Route/Confirm/Clarify 세 단계로 나누고, 호출 실패나 시간 초과 시 오프라인 매처로 한 번만 전환하기 위함.
 *
 * <p>재시도는 하지 않는다. 기기가 네트워크 없음을 알리면 LLM을 아예 호출하지 않는다.
 */
public class IntentClassifier {

    private static final Logger log = Logger.getLogger(IntentClassifier.class);

    private final LlmPort llmPort;
    private final OfflineIntentMatcher offlineMatcher;
    private final ClarificationGenerator clarificationGenerator;
    private final EntityExtractor entityExtractor;
    private final IntentCatalog catalog;
    private final ClassifierPolicy policy;
    private final Executor llmExecutor;

    public IntentClassifier(LlmPort llmPort,
                            OfflineIntentMatcher offlineMatcher,
                            ClarificationGenerator clarificationGenerator,
                            EntityExtractor entityExtractor,
                            IntentCatalog catalog,
                            ClassifierPolicy policy,
                            Executor llmExecutor) {
        this.llmPort = llmPort;
        this.offlineMatcher = offlineMatcher;
        this.clarificationGenerator = clarificationGenerator;
        this.entityExtractor = entityExtractor;
        this.catalog = catalog;
        this.policy = policy;
        this.llmExecutor = llmExecutor;
    }

    public ClassificationVerdict classify(ClassificationInput input) {
        ClassificationSource source = input.networkAvailable() ? ClassificationSource.ONLINE : ClassificationSource.OFFLINE;
        if (input.normalizedText().isBlank()) {
            List<IntentType> fillers = input.networkAvailable()
                    ? ClarificationGenerator.ONLINE_DEFAULTS
                    : ClarificationGenerator.OFFLINE_DEFAULTS;
            ClarificationResponse clarification =
                    clarificationGenerator.generate(List.of(), ClarificationTier.EMPTY_INPUT, fillers);
            return new ClassificationVerdict.Clarify(placeholder(input), clarification, source);
        }
        if (!input.networkAvailable()) {
            return classifyOffline(input);
        }
        Optional<LlmIntentResult> online = callClassifier(input);
        if (online.isEmpty()) {
            return classifyOffline(input);
        }
        return gate(input, online.get());
    }

    private Optional<LlmIntentResult> callClassifier(ClassificationInput input) {
        Duration budget = policy.budget(input.modality());
        return Uni.createFrom().item(() -> validated(llmPort.classify(input.normalizedText(), input.context())))
                .runSubscriptionOn(llmExecutor)
                .ifNoItem().after(budget).fail()
                .onItem().transform(Optional::of)
                .onFailure().recoverWithItem(failure -> {
                    log.warnf("분류기 사용 불가, 오프라인 매칭으로 전환: intentId=%s, cause=%s: %s",
                            input.intentId(), failure.getClass().getSimpleName(), failure.getMessage());
                    return Optional.empty();
                })
                .await().indefinitely();
    }

    private static LlmIntentResult validated(LlmIntentResult result) {
        if (result == null) {
            throw new IntentParseException("LLM 결과가 null입니다.");
        }
        double confidence = result.confidence();
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IntentParseException("LLM 신뢰도가 범위를 벗어났습니다: " + confidence);
        }
        return result;
    }

    private ClassificationVerdict gate(ClassificationInput input, LlmIntentResult result) {
        Entities entities = result.entities().mergedWith(entityExtractor.extract(input.normalizedText()));
        Intent intent = new Intent(input.intentId(), result.intentType(), result.confidence(), entities, input.rawInput());
        if (result.confidence() >= policy.routeThreshold()) {
            return new ClassificationVerdict.Route(intent, ClassificationSource.ONLINE);
        }
        if (result.confidence() >= policy.confirmThreshold()) {
            return new ClassificationVerdict.Confirm(intent, confirmationMessage(intent), ClassificationSource.ONLINE);
        }
        boolean nearMiss = result.confidence() >= ClassifierPolicy.NEAR_MISS_FLOOR;
        List<ScoredIntent> candidates = mergeCandidates(
                nearMiss ? List.of(new ScoredIntent(result.intentType(), result.confidence())) : List.of(),
                offlineMatcher.scoreAll(input.normalizedText()));
        ClarificationResponse clarification = clarificationGenerator.generate(candidates,
                nearMiss ? ClarificationTier.NEAR_MISS : ClarificationTier.UNCLEAR,
                ClarificationGenerator.ONLINE_DEFAULTS);
        return new ClassificationVerdict.Clarify(intent, clarification, ClassificationSource.ONLINE);
    }

    private ClassificationVerdict classifyOffline(ClassificationInput input) {
        OfflineResult result = offlineMatcher.resolve(input.intentId(), input.rawInput(), input.normalizedText());
        log.infof("오프라인 분류 결과: intentId=%s, result=%s", input.intentId(), result.getClass().getSimpleName());
        if (result instanceof OfflineResult.Match match) {
            return new ClassificationVerdict.Route(match.intent(), ClassificationSource.OFFLINE);
        }
        if (result instanceof OfflineResult.Clarify clarify) {
            IntentType best = clarify.clarification().suggestedTypes().get(0);
            Intent bestGuess = new Intent(input.intentId(), best, Math.min(1.0, clarify.bestScore()),
                    entityExtractor.extract(input.normalizedText()), input.rawInput());
            return new ClassificationVerdict.Clarify(bestGuess, clarify.clarification(), ClassificationSource.OFFLINE);
        }
        if (result instanceof OfflineResult.RequiresOnline requiresOnline) {
            Intent bestGuess = new Intent(input.intentId(), requiresOnline.intentType(), 0.0,
                    entityExtractor.extract(input.normalizedText()), input.rawInput());
            ClarificationResponse menu =
                    clarificationGenerator.offlineMenu(ClarificationTier.REQUIRES_ONLINE, requiresOnline.message());
            return new ClassificationVerdict.Clarify(bestGuess, menu, ClassificationSource.OFFLINE);
        }
        OfflineResult.NoMatch noMatch = (OfflineResult.NoMatch) result;
        ClarificationResponse menu = clarificationGenerator.offlineMenu(ClarificationTier.OFFLINE_NO_MATCH, noMatch.message());
        return new ClassificationVerdict.Clarify(placeholder(input), menu, ClassificationSource.OFFLINE);
    }

    /**
     * "Did you want to &lt;동작&gt;?" 뒤에 추출된 값이 있으면 괄호로 덧붙인다. 문구는 고정이다.
     */
    String confirmationMessage(Intent intent) {
        StringBuilder message = new StringBuilder("Did you want to ")
                .append(catalog.definition(intent.type()).confirmPhrase())
                .append('?');
        List<String> details = new ArrayList<>();
        Entities entities = intent.entities();
        if (entities.club() != null) {
            details.add("with " + entities.club());
        }
        if (entities.holeNumber() != null) {
            details.add("on hole " + entities.holeNumber());
        }
        if (entities.yardage() != null) {
            details.add("at " + entities.yardage() + " yards");
        }
        if (entities.lie() != null) {
            details.add("from the " + entities.lie().name().toLowerCase(Locale.ROOT));
        }
        if (entities.score() != null) {
            details.add("score " + entities.score());
        }
        if (!details.isEmpty()) {
            message.append(" (").append(String.join(", ", details)).append(')');
        }
        return message.toString();
    }

    private static List<ScoredIntent> mergeCandidates(List<ScoredIntent> primary, List<ScoredIntent> secondary) {
        Map<IntentType, Double> best = new EnumMap<>(IntentType.class);
        primary.forEach(scored -> best.merge(scored.type(), scored.score(), Math::max));
        secondary.forEach(scored -> best.merge(scored.type(), scored.score(), Math::max));
        List<ScoredIntent> merged = new ArrayList<>();
        best.forEach((type, score) -> merged.add(new ScoredIntent(type, score)));
        merged.sort(ScoredIntent.BY_SCORE_DESC);
        return merged;
    }

    private static Intent placeholder(ClassificationInput input) {
        return new Intent(input.intentId(), IntentType.HELP_REQUEST, 0.0, Entities.empty(), input.rawInput());
    }
}
