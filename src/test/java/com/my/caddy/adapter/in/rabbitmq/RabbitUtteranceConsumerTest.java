package com.my.caddy.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.caddy.adapter.in.idempotency.IdempotencyStore;
import com.my.caddy.domain.exception.ContractViolationException;
import com.my.caddy.domain.model.Entities;
import com.my.caddy.domain.model.Intent;
import com.my.caddy.domain.model.IntentType;
import com.my.caddy.domain.model.RoutingResult;
import com.my.caddy.domain.model.UtteranceRequest;
import com.my.caddy.domain.port.in.ProcessUtteranceUseCase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RabbitUtteranceConsumerTest {

    private static final String PAYLOAD = """
            {"eventId":"e1","timestamp":"2026-06-01T12:00:00Z","userId":"u1","modality":"TEXT","content":"show my stats"}
            """;

    private ProcessUtteranceUseCase useCase;
    private IdempotencyStore idempotencyStore;
    private RabbitUtteranceConsumer consumer;

    @BeforeEach
    void setUp() {
        useCase = mock(ProcessUtteranceUseCase.class);
        idempotencyStore = mock(IdempotencyStore.class);
        consumer = new RabbitUtteranceConsumer(useCase, idempotencyStore, new ObjectMapper());
    }

    @Test
    void processes_new_utterance_and_marks_it() {
        Intent intent = new Intent("e1", IntentType.STATS_LOOKUP, 0.9, Entities.empty(), "show my stats");
        when(useCase.process(any())).thenReturn(new RoutingResult.NoNavigation(intent, "ok"));

        consumer.handle(PAYLOAD);

        ArgumentCaptor<UtteranceRequest> request = ArgumentCaptor.forClass(UtteranceRequest.class);
        verify(useCase).process(request.capture());
        assertThat(request.getValue().content()).isEqualTo("show my stats");
        verify(idempotencyStore).markProcessed("e1");
    }

    @Test
    void duplicate_event_is_skipped() {
        when(idempotencyStore.isProcessed("e1")).thenReturn(true);

        consumer.handle(PAYLOAD);

        verify(useCase, never()).process(any());
        verify(idempotencyStore, never()).markProcessed(anyString());
    }

    @Test
    void malformed_payload_is_dropped() {
        consumer.handle("{not json");
        consumer.handle("{\"eventId\":\"e2\",\"userId\":\"u1\",\"content\":\"hi\"}");

        verify(useCase, never()).process(any());
    }

    @Test
    void rejected_request_is_not_marked() {
        when(useCase.process(any())).thenThrow(new ContractViolationException("bad"));

        consumer.handle(PAYLOAD);

        verify(idempotencyStore, never()).markProcessed(anyString());
    }
}
