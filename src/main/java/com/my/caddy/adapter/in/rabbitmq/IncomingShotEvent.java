package com.my.caddy.adapter.in.rabbitmq;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.my.caddy.domain.exception.InvalidRequestException;
import com.my.caddy.domain.model.Lie;
import com.my.caddy.domain.model.MissDirection;
import com.my.caddy.domain.model.MissEvent;
import com.my.caddy.domain.model.PressureContext;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;

/**
 * 샷 기록기가 보내는 미스 이벤트. 압박 여부를 생략하면 압박 없음으로 본다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IncomingShotEvent(String eventId,
                                String timestamp,
                                String clubId,
                                String missDirection,
                                String lie,
                                Boolean pressureTagged,
                                Boolean pressureInferred,
                                Integer holeNumber,
                                String notes) {

    public IncomingShotEvent {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(clubId, "clubId");
        Objects.requireNonNull(missDirection, "missDirection");
        Objects.requireNonNull(lie, "lie");
        if (eventId.isBlank() || clubId.isBlank()) {
            throw new InvalidRequestException("샷 이벤트 식별자가 비어 있습니다.");
        }
    }

    public MissEvent toMissEvent() {
        try {
            return new MissEvent(
                    eventId,
                    OffsetDateTime.parse(timestamp).toInstant(),
                    clubId.trim().toLowerCase(Locale.ROOT),
                    MissDirection.valueOf(missDirection.trim().toUpperCase(Locale.ROOT)),
                    Lie.valueOf(lie.trim().toUpperCase(Locale.ROOT)),
                    new PressureContext(Boolean.TRUE.equals(pressureTagged), Boolean.TRUE.equals(pressureInferred)),
                    holeNumber,
                    notes);
        } catch (DateTimeParseException | IllegalArgumentException e) {
            throw new InvalidRequestException("샷 이벤트 형식이 올바르지 않습니다.", e);
        }
    }
}
