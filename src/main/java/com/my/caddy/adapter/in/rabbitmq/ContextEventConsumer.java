package com.my.caddy.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.caddy.domain.exception.ContractViolationException;
import com.my.caddy.domain.exception.InvalidRequestException;
import com.my.caddy.domain.model.ContextEvent;
import com.my.caddy.domain.port.in.UpdateContextUseCase;
import io.smallrye.mutiny.Uni;
import io.smallrye.reactive.messaging.annotations.Blocking;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.io.IOException;

@ApplicationScoped
public class ContextEventConsumer {

    private static final Logger log = Logger.getLogger(ContextEventConsumer.class);

    private final UpdateContextUseCase updateContextUseCase;
    private final ObjectMapper objectMapper;

    @Inject
    public ContextEventConsumer(UpdateContextUseCase updateContextUseCase, ObjectMapper objectMapper) {
        this.updateContextUseCase = updateContextUseCase;
        this.objectMapper = objectMapper;
    }

    @Incoming("context-events")
    @Blocking
    public Uni<Void> consume(Message<String> message) {
        return Uni.createFrom().item(() -> {
            handle(message.getPayload());
            return null;
        }).replaceWithVoid();
    }

    void handle(String payload) {
        ContextEvent event;
        try {
            event = objectMapper.readValue(payload, IncomingContextEvent.class).toContextEvent();
        } catch (IOException | InvalidRequestException e) {
            log.warnf("컨텍스트 이벤트 파싱 실패: %s", e.getMessage());
            return;
        }
        MDC.put("eventId", event.eventId());
        MDC.put("userId", event.userId());
        try {
            updateContextUseCase.apply(event);
        } catch (ContractViolationException e) {
            log.warnf("컨텍스트 이벤트 거부: %s", e.getMessage());
        } finally {
            MDC.remove("eventId");
            MDC.remove("userId");
        }
    }
}
