package com.my.caddy.domain.model;

import java.time.Instant;
import java.util.Objects;

public record ConversationTurn(Role role, String content, Instant timestamp) {
    public ConversationTurn {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
