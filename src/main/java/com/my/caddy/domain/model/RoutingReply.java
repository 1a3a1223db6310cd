package com.my.caddy.domain.model;

import java.util.Objects;

/**
 * 왜: 최종 라우팅 결정을 어댑터가 일관된 포맷으로 전송하도록 응답 계약을 고정하기 위함.
 */
public record RoutingReply(String replyToUserId, String eventId, String route, RoutingResult result) {
    public RoutingReply {
        Objects.requireNonNull(replyToUserId, "replyToUserId");
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(result, "result");
        if (replyToUserId.isBlank()) {
            throw new IllegalArgumentException("replyToUserId는 비어 있을 수 없습니다.");
        }
    }
}
