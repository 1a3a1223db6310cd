package com.my.caddy.adapter.out.prerequisite;

import com.my.caddy.domain.model.Prerequisite;
import com.my.caddy.domain.model.RoundState;
import com.my.caddy.domain.port.out.PlayerDataPort;
import com.my.caddy.domain.port.out.PrerequisitePort;
import com.my.caddy.domain.session.SessionRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;
import java.util.Optional;

/**
 * 왜: 라운드 관련 조건은 세션에서, 선수 데이터 조건은 {@link PlayerDataPort}에서 판정해 하나의 포트로 묶는다.
 */
@ApplicationScoped
public class SessionPrerequisiteAdapter implements PrerequisitePort {

    private final SessionRegistry sessionRegistry;
    private final PlayerDataPort playerDataPort;

    @Inject
    public SessionPrerequisiteAdapter(SessionRegistry sessionRegistry, PlayerDataPort playerDataPort) {
        this.sessionRegistry = sessionRegistry;
        this.playerDataPort = playerDataPort;
    }

    @Override
    public List<Prerequisite> unmet(String userId, List<Prerequisite> required) {
        Optional<RoundState> round = sessionRegistry.existing(userId).flatMap(session -> session.round());
        return required.stream()
                .filter(prerequisite -> !isMet(prerequisite, userId, round))
                .toList();
    }

    private boolean isMet(Prerequisite prerequisite, String userId, Optional<RoundState> round) {
        return switch (prerequisite) {
            case ROUND_ACTIVE -> round.isPresent();
            case COURSE_SELECTED -> round.map(RoundState::hasCourse).orElse(false);
            case RECOVERY_DATA -> playerDataPort.hasRecoveryData(userId);
            case BAG_CONFIGURED -> playerDataPort.hasBagConfigured(userId);
        };
    }
}
