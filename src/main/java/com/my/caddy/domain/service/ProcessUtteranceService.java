package com.my.caddy.domain.service;

import com.my.caddy.domain.classifier.ClassificationInput;
import com.my.caddy.domain.classifier.IntentClassifier;
import com.my.caddy.domain.memory.MissPatternStore;
import com.my.caddy.domain.model.ClassificationVerdict;
import com.my.caddy.domain.model.ConversationTurn;
import com.my.caddy.domain.model.NormalizationResult;
import com.my.caddy.domain.model.Role;
import com.my.caddy.domain.model.RoutingReply;
import com.my.caddy.domain.model.RoutingResult;
import com.my.caddy.domain.model.UtteranceRequest;
import com.my.caddy.domain.normalizer.InputNormalizer;
import com.my.caddy.domain.port.in.ProcessUtteranceUseCase;
import com.my.caddy.domain.port.out.ClockPort;
import com.my.caddy.domain.port.out.PrerequisitePort;
import com.my.caddy.domain.port.out.ReplyPort;
import com.my.caddy.domain.routing.DeepLinkBuilder;
import com.my.caddy.domain.routing.MissPatternResponseComposer;
import com.my.caddy.domain.routing.RoutingOrchestrator;
import com.my.caddy.domain.routing.TemplateResponseComposer;
import com.my.caddy.domain.session.SessionContext;
import com.my.caddy.domain.session.SessionRegistry;
import org.jboss.logging.Logger;

import java.time.Instant;

/**
 * 왜: 정규화, 분류, 라우팅, 세션 기록, 응답 전송을 순서대로 한 번씩만 실행하는 단일 유스케이스로 묶기 위함.
 */
public class ProcessUtteranceService implements ProcessUtteranceUseCase {

    private static final Logger log = Logger.getLogger(ProcessUtteranceService.class);

    private final InputNormalizer normalizer;
    private final IntentClassifier classifier;
    private final RoutingOrchestrator orchestrator;
    private final DeepLinkBuilder deepLinkBuilder;
    private final SessionRegistry sessionRegistry;
    private final PrerequisitePort prerequisitePort;
    private final MissPatternStore patternStore;
    private final ReplyPort replyPort;
    private final ClockPort clockPort;
    private final TemplateResponseComposer templates = new TemplateResponseComposer();

    public ProcessUtteranceService(InputNormalizer normalizer,
                                   IntentClassifier classifier,
                                   RoutingOrchestrator orchestrator,
                                   DeepLinkBuilder deepLinkBuilder,
                                   SessionRegistry sessionRegistry,
                                   PrerequisitePort prerequisitePort,
                                   MissPatternStore patternStore,
                                   ReplyPort replyPort,
                                   ClockPort clockPort) {
        this.normalizer = normalizer;
        this.classifier = classifier;
        this.orchestrator = orchestrator;
        this.deepLinkBuilder = deepLinkBuilder;
        this.sessionRegistry = sessionRegistry;
        this.prerequisitePort = prerequisitePort;
        this.patternStore = patternStore;
        this.replyPort = replyPort;
        this.clockPort = clockPort;
    }

    @Override
    public RoutingResult process(UtteranceRequest request) {
        Instant now = clockPort.now().toInstant();
        SessionContext session = sessionRegistry.session(request.userId());
        NormalizationResult normalized = normalizer.normalize(request.content());

        ClassificationVerdict verdict = classifier.classify(new ClassificationInput(
                request.eventId(),
                request.content(),
                normalized.normalizedText(),
                request.modality(),
                request.networkAvailable(),
                session.snapshot()));

        RoutingResult result = orchestrator.route(
                verdict,
                required -> prerequisitePort.unmet(request.userId(), required),
                new MissPatternResponseComposer(templates, patternStore, now));

        String route = result instanceof RoutingResult.Navigate navigate
                ? deepLinkBuilder.buildRoute(navigate.target())
                : null;
        log.infof("라우팅 완료: eventId=%s, source=%s, result=%s, intent=%s",
                request.eventId(), verdict.source(), result.getClass().getSimpleName(), result.intent().type());

        session.addTurn(new ConversationTurn(Role.USER, request.content(), now));
        session.addTurn(new ConversationTurn(Role.ASSISTANT, assistantText(result, route), now));

        replyPort.send(new RoutingReply(request.userId(), request.eventId(), route, result));
        return result;
    }

    private static String assistantText(RoutingResult result, String route) {
        if (result instanceof RoutingResult.Navigate) {
            return "navigate " + route;
        }
        if (result instanceof RoutingResult.NoNavigation noNavigation) {
            return noNavigation.response();
        }
        if (result instanceof RoutingResult.ConfirmationRequired confirmation) {
            return confirmation.message();
        }
        return ((RoutingResult.PrerequisiteMissing) result).message();
    }
}
