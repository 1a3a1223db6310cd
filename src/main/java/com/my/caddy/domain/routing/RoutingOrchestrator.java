package com.my.caddy.domain.routing;

import com.my.caddy.domain.catalog.IntentCatalog;
import com.my.caddy.domain.catalog.IntentDefinition;
import com.my.caddy.domain.model.ClassificationVerdict;
import com.my.caddy.domain.model.Intent;
import com.my.caddy.domain.model.Prerequisite;
import com.my.caddy.domain.model.RoutingResult;
import com.my.caddy.domain.model.RoutingTarget;

import java.util.List;

/**
 * 왜: 분류 판정을 정확히 하나의 {@link RoutingResult}로 바꾼다. 결과는 (의도, 판정, 전제 조건 확인 결과)만으로 정해지며 시각이나 호출 횟수에 영향받지 않는다.
 *
 * <p>전제 조건 확인기는 의도가 선언한 전제 조건 목록 그대로 호출된다. 선언이 없으면 호출하지 않는다.
 */
public class RoutingOrchestrator {

    private final IntentCatalog catalog;
    private final ResponseComposer defaultComposer;

    public RoutingOrchestrator(IntentCatalog catalog, ResponseComposer defaultComposer) {
        this.catalog = catalog;
        this.defaultComposer = defaultComposer;
    }

    public RoutingResult route(ClassificationVerdict verdict, PrerequisiteChecker checker) {
        return route(verdict, checker, defaultComposer);
    }

    public RoutingResult route(ClassificationVerdict verdict, PrerequisiteChecker checker, ResponseComposer composer) {
        if (verdict instanceof ClassificationVerdict.Clarify clarify) {
            return new RoutingResult.ConfirmationRequired(
                    clarify.bestGuess(),
                    clarify.clarification().message(),
                    clarify.clarification().suggestedTypes());
        }
        if (verdict instanceof ClassificationVerdict.Confirm confirm) {
            List<Prerequisite> missing = missingFor(confirm.intent(), checker);
            if (!missing.isEmpty()) {
                return prerequisiteMissing(confirm.intent(), missing);
            }
            return new RoutingResult.ConfirmationRequired(
                    confirm.intent(), confirm.message(), List.of(confirm.intent().type()));
        }
        ClassificationVerdict.Route route = (ClassificationVerdict.Route) verdict;
        Intent intent = route.intent();
        IntentDefinition definition = catalog.definition(intent.type());
        if (!definition.navigable()) {
            return new RoutingResult.NoNavigation(intent, composer.compose(intent));
        }
        List<Prerequisite> missing = missingFor(intent, checker);
        if (!missing.isEmpty()) {
            return prerequisiteMissing(intent, missing);
        }
        RoutingTarget target = definition.destination().withParameters(intent.entities().toParameters());
        return new RoutingResult.Navigate(target, intent);
    }

    private List<Prerequisite> missingFor(Intent intent, PrerequisiteChecker checker) {
        List<Prerequisite> required = catalog.prerequisites(intent.type());
        if (required.isEmpty()) {
            return List.of();
        }
        List<Prerequisite> unmet = checker.checkAll(required);
        if (unmet == null || unmet.isEmpty()) {
            return List.of();
        }
        // 확인기가 요구하지 않은 항목을 돌려줘도 선언된 것만, 선언 순서대로 남긴다.
        return required.stream().filter(unmet::contains).toList();
    }

    private static RoutingResult prerequisiteMissing(Intent intent, List<Prerequisite> missing) {
        return new RoutingResult.PrerequisiteMissing(intent, missing, PrerequisiteGuidance.message(missing));
    }
}
