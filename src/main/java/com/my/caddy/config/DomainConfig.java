package com.my.caddy.config;

import com.my.caddy.adapter.out.clock.OffsetClockAdapter;
import com.my.caddy.domain.catalog.IntentCatalog;
import com.my.caddy.domain.classifier.ClassifierPolicy;
import com.my.caddy.domain.classifier.IntentClassifier;
import com.my.caddy.domain.clarification.ClarificationGenerator;
import com.my.caddy.domain.memory.DecayCalculator;
import com.my.caddy.domain.memory.MissPatternAggregator;
import com.my.caddy.domain.memory.MissPatternStore;
import com.my.caddy.domain.normalizer.EntityExtractor;
import com.my.caddy.domain.normalizer.InputNormalizer;
import com.my.caddy.domain.offline.KeywordTable;
import com.my.caddy.domain.offline.OfflineIntentMatcher;
import com.my.caddy.domain.port.in.ProcessUtteranceUseCase;
import com.my.caddy.domain.port.in.QueryPatternsUseCase;
import com.my.caddy.domain.port.in.RecordMissUseCase;
import com.my.caddy.domain.port.in.UpdateContextUseCase;
import com.my.caddy.domain.port.out.ClockPort;
import com.my.caddy.domain.port.out.LlmPort;
import com.my.caddy.domain.port.out.MissMemoryPort;
import com.my.caddy.domain.port.out.PlayerDataPort;
import com.my.caddy.domain.port.out.PrerequisitePort;
import com.my.caddy.domain.port.out.ReplyPort;
import com.my.caddy.domain.routing.DeepLinkBuilder;
import com.my.caddy.domain.routing.RoutingOrchestrator;
import com.my.caddy.domain.routing.TemplateResponseComposer;
import com.my.caddy.domain.service.ContextUpdateService;
import com.my.caddy.domain.service.PatternQueryService;
import com.my.caddy.domain.service.ProcessUtteranceService;
import com.my.caddy.domain.service.RecordMissService;
import com.my.caddy.domain.session.SessionRegistry;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import java.time.Duration;
import java.time.ZoneId;

/**
 * 왜: 순수 도메인 객체와 포트 구현을 명시적으로 연결하여 헥사고날 구조를 보장하기 위함.
 */
@ApplicationScoped
public class DomainConfig {

    @Produces
    @ApplicationScoped
    public IntentCatalog intentCatalog() {
        return new IntentCatalog();
    }

    @Produces
    @ApplicationScoped
    public SessionRegistry sessionRegistry(AppConfig appConfig) {
        return new SessionRegistry(appConfig.session().historyCapacity());
    }

    @Produces
    @ApplicationScoped
    public DecayCalculator decayCalculator(AppConfig appConfig) {
        return new DecayCalculator(appConfig.memory().halfLifeDays(), appConfig.memory().retentionDays());
    }

    @Produces
    @ApplicationScoped
    public MissPatternStore missPatternStore(MissMemoryPort missMemoryPort,
                                             DecayCalculator decayCalculator,
                                             AppConfig appConfig) {
        AppConfig.MemoryConfig memory = appConfig.memory();
        MissPatternAggregator aggregator =
                new MissPatternAggregator(decayCalculator, memory.minSamples(), memory.minShare());
        return new MissPatternStore(missMemoryPort, aggregator, decayCalculator, memory.windowDays(), memory.maxEvents());
    }

    @Produces
    @ApplicationScoped
    public IntentClassifier intentClassifier(LlmPort llmPort, IntentCatalog catalog, AppConfig appConfig) {
        ClarificationGenerator clarificationGenerator = new ClarificationGenerator(catalog);
        EntityExtractor entityExtractor = new EntityExtractor();
        OfflineIntentMatcher offlineMatcher = new OfflineIntentMatcher(
                KeywordTable.defaults(),
                catalog,
                clarificationGenerator,
                entityExtractor,
                appConfig.offline().strongThreshold(),
                appConfig.offline().weakThreshold());
        ClassifierPolicy policy = new ClassifierPolicy(
                appConfig.classifier().routeThreshold(),
                appConfig.classifier().confirmThreshold(),
                Duration.ofMillis(appConfig.classifier().textTimeoutMs()),
                Duration.ofMillis(appConfig.classifier().voiceTimeoutMs()));
        return new IntentClassifier(llmPort, offlineMatcher, clarificationGenerator, entityExtractor, catalog, policy,
                Infrastructure.getDefaultWorkerPool());
    }

    @Produces
    @ApplicationScoped
    public ProcessUtteranceUseCase processUtteranceUseCase(IntentClassifier intentClassifier,
                                                           IntentCatalog catalog,
                                                           SessionRegistry sessionRegistry,
                                                           PrerequisitePort prerequisitePort,
                                                           MissPatternStore missPatternStore,
                                                           ReplyPort replyPort,
                                                           ClockPort clockPort) {
        return new ProcessUtteranceService(
                new InputNormalizer(),
                intentClassifier,
                new RoutingOrchestrator(catalog, new TemplateResponseComposer()),
                new DeepLinkBuilder(catalog),
                sessionRegistry,
                prerequisitePort,
                missPatternStore,
                replyPort,
                clockPort);
    }

    @Produces
    @ApplicationScoped
    public RecordMissUseCase recordMissUseCase(MissPatternStore missPatternStore, ClockPort clockPort) {
        return new RecordMissService(missPatternStore, clockPort);
    }

    @Produces
    @ApplicationScoped
    public QueryPatternsUseCase queryPatternsUseCase(MissPatternStore missPatternStore, ClockPort clockPort) {
        return new PatternQueryService(missPatternStore, clockPort);
    }

    @Produces
    @ApplicationScoped
    public UpdateContextUseCase updateContextUseCase(SessionRegistry sessionRegistry, PlayerDataPort playerDataPort) {
        return new ContextUpdateService(sessionRegistry, playerDataPort);
    }

    @Produces
    @ApplicationScoped
    public ClockPort clockPort(AppConfig appConfig) {
        return OffsetClockAdapter.of(ZoneId.of(appConfig.clock().zone()));
    }
}
