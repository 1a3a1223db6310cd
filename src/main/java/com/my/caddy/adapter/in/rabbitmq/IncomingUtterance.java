package com.my.caddy.adapter.in.rabbitmq;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.my.caddy.domain.exception.InvalidRequestException;
import com.my.caddy.domain.model.InputModality;
import com.my.caddy.domain.model.UtteranceRequest;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;

/**
 * 빈 발화는 허용한다. 되묻기 응답으로 처리된다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IncomingUtterance(String eventId,
                                String timestamp,
                                String userId,
                                String modality,
                                String content,
                                Boolean networkAvailable) {

    public IncomingUtterance {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(content, "content");
        if (eventId.isBlank() || userId.isBlank()) {
            throw new InvalidRequestException("요청 식별자가 비어 있습니다.");
        }
    }

    public UtteranceRequest toUtteranceRequest() {
        try {
            OffsetDateTime parsed = OffsetDateTime.parse(timestamp);
            InputModality inputModality = modality == null || modality.isBlank()
                    ? InputModality.TEXT
                    : InputModality.valueOf(modality.trim().toUpperCase(Locale.ROOT));
            boolean online = networkAvailable == null || networkAvailable;
            return new UtteranceRequest(eventId, parsed, userId, inputModality, content, online);
        } catch (DateTimeParseException | IllegalArgumentException e) {
            throw new InvalidRequestException("요청 필드 형식이 올바르지 않습니다.", e);
        }
    }
}
