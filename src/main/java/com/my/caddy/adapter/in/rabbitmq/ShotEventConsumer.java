package com.my.caddy.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.caddy.domain.exception.ContractViolationException;
import com.my.caddy.domain.exception.InvalidRequestException;
import com.my.caddy.domain.model.MissEvent;
import com.my.caddy.domain.port.in.RecordMissUseCase;
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
 * 왜: 샷 기록기가 발행한 미스 이벤트를 미스 기억에 적재하는 진입 어댑터가 필요하기 때문.
 */
@ApplicationScoped
public class ShotEventConsumer {

    private static final Logger log = Logger.getLogger(ShotEventConsumer.class);

    private final RecordMissUseCase recordMissUseCase;
    private final ObjectMapper objectMapper;

    @Inject
    public ShotEventConsumer(RecordMissUseCase recordMissUseCase, ObjectMapper objectMapper) {
        this.recordMissUseCase = recordMissUseCase;
        this.objectMapper = objectMapper;
    }

    @Incoming("shot-events")
    @Blocking
    public Uni<Void> consume(Message<String> message) {
        return Uni.createFrom().item(() -> {
            handle(message.getPayload());
            return null;
        }).replaceWithVoid();
    }

    void handle(String payload) {
        MissEvent event;
        try {
            event = objectMapper.readValue(payload, IncomingShotEvent.class).toMissEvent();
        } catch (IOException | InvalidRequestException e) {
            log.warnf("샷 이벤트 파싱 실패: %s", e.getMessage());
            return;
        }
        MDC.put("eventId", event.id());
        try {
            recordMissUseCase.record(event);
        } catch (ContractViolationException e) {
            log.warnf("샷 이벤트 거부: %s", e.getMessage());
        } finally {
            MDC.remove("eventId");
        }
    }
}
