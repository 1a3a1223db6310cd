package com.my.caddy.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.caddy.adapter.in.idempotency.IdempotencyStore;
import com.my.caddy.domain.exception.ContractViolationException;
import com.my.caddy.domain.exception.InvalidRequestException;
import com.my.caddy.domain.model.RoutingResult;
import com.my.caddy.domain.model.UtteranceRequest;
import com.my.caddy.domain.port.in.ProcessUtteranceUseCase;
import io.smallrye.mutiny.Uni;
import io.smallrye.reactive.messaging.annotations.Blocking;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.io.IOException;

/**
 * 왜: RabbitMQ로 들어온 발화를 라우팅 유스케이스로 진입시키는 단일 경로를 제공하기 위함.
 *
 * <p>형식이 잘못된 메시지는 경고만 남기고 확인 처리한다. 재전달해도 결과가 같기 때문이다.
 */
@ApplicationScoped
public class RabbitUtteranceConsumer {

    private static final Logger log = Logger.getLogger(RabbitUtteranceConsumer.class);

    private final ProcessUtteranceUseCase processUtteranceUseCase;
    private final IdempotencyStore idempotencyStore;
    private final ObjectMapper objectMapper;

    @Inject
    public RabbitUtteranceConsumer(ProcessUtteranceUseCase processUtteranceUseCase,
                                   IdempotencyStore idempotencyStore,
                                   ObjectMapper objectMapper) {
        this.processUtteranceUseCase = processUtteranceUseCase;
        this.idempotencyStore = idempotencyStore;
        this.objectMapper = objectMapper;
    }

    @Incoming("caddy-requests")
    @Blocking
    public Uni<Void> consume(Message<String> message) {
        return Uni.createFrom().item(() -> {
            handle(message.getPayload());
            return null;
        }).replaceWithVoid();
    }

    void handle(String payload) {
        UtteranceRequest request;
        try {
            request = objectMapper.readValue(payload, IncomingUtterance.class).toUtteranceRequest();
        } catch (IOException | InvalidRequestException e) {
            log.warnf("발화 요청 파싱 실패로 처리 중단: %s", e.getMessage());
            return;
        }
        MDC.put("eventId", request.eventId());
        MDC.put("userId", request.userId());
        try {
            if (idempotencyStore.isProcessed(request.eventId())) {
                log.infof("중복 발화를 건너뜁니다: %s", request.eventId());
                return;
            }
            RoutingResult result = processUtteranceUseCase.process(request);
            idempotencyStore.markProcessed(request.eventId());
            log.debugf("발화 처리 완료: result=%s", result.getClass().getSimpleName());
        } catch (InvalidRequestException | ContractViolationException e) {
            log.warnf("발화 검증 실패로 처리 중단: %s", e.getMessage());
        } finally {
            MDC.remove("eventId");
            MDC.remove("userId");
        }
    }
}
