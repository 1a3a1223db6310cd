package com.my.caddy.domain.model;

import java.util.Objects;

/**
 * 라운드 진행과 선수 데이터 변경 알림. 종류에 따라 쓰이는 필드만 채워진다.
 */
public record ContextEvent(
        String eventId,
        String userId,
        ContextEventType type,
        String roundId,
        String courseName,
        Integer hole,
        Integer par
) {
    public ContextEvent {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(type, "type");
    }
}
