package com.my.caddy.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * 재계산 시점에 구체화된 패턴 묶음. 신뢰도는 {@code refreshedAt} 기준으로 이미 감쇠되어 있다.
 */
public record StoredPatterns(List<MissPattern> patterns, Instant refreshedAt) {

    public StoredPatterns {
        patterns = List.copyOf(Objects.requireNonNull(patterns, "patterns"));
        Objects.requireNonNull(refreshedAt, "refreshedAt");
    }
}
