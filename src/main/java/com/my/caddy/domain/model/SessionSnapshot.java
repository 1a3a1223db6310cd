package com.my.caddy.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * 세션 상태의 불변 복사본. 분류기에 전달되는 맥락이다.
 */
public record SessionSnapshot(List<ConversationTurn> turns, RoundState round) {

    public static final SessionSnapshot EMPTY = new SessionSnapshot(List.of(), null);

    public SessionSnapshot {
        turns = turns == null ? List.of() : List.copyOf(turns);
    }

    public Optional<RoundState> activeRound() {
        return Optional.ofNullable(round);
    }
}
