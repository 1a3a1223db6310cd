package com.my.caddy.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 왜: 샷 기록기가 한 번 쓰고 집계기가 여러 번 읽는 불변 이벤트의 최소 계약을 고정하기 위함.
 */
public record MissEvent(
        String id,
        Instant timestamp,
        String clubId,
        MissDirection missDirection,
        Lie lie,
        PressureContext pressureContext,
        Integer holeNumber,
        String notes
) {
    public MissEvent {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(clubId, "clubId");
        Objects.requireNonNull(missDirection, "missDirection");
        Objects.requireNonNull(lie, "lie");
        pressureContext = pressureContext == null ? PressureContext.NONE : pressureContext;
        if (holeNumber != null && (holeNumber < 1 || holeNumber > 18)) {
            holeNumber = null;
        }
    }
}
