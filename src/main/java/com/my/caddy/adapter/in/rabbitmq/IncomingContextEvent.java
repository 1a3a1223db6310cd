package com.my.caddy.adapter.in.rabbitmq;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.my.caddy.domain.exception.InvalidRequestException;
import com.my.caddy.domain.model.ContextEvent;
import com.my.caddy.domain.model.ContextEventType;

import java.util.Locale;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record IncomingContextEvent(String eventId,
                                   String userId,
                                   String type,
                                   String roundId,
                                   String courseName,
                                   Integer hole,
                                   Integer par) {

    public IncomingContextEvent {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(type, "type");
        if (eventId.isBlank() || userId.isBlank()) {
            throw new InvalidRequestException("컨텍스트 이벤트 식별자가 비어 있습니다.");
        }
        if (hole != null && (hole < 1 || hole > 18)) {
            throw new InvalidRequestException("홀 번호는 1~18이어야 합니다: " + hole);
        }
        if (par != null && (par < 3 || par > 5)) {
            throw new InvalidRequestException("파는 3~5여야 합니다: " + par);
        }
    }

    public ContextEvent toContextEvent() {
        try {
            ContextEventType eventType = ContextEventType.valueOf(type.trim().toUpperCase(Locale.ROOT));
            return new ContextEvent(eventId, userId, eventType, roundId, courseName, hole, par);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("알 수 없는 컨텍스트 이벤트 종류: " + type, e);
        }
    }
}
