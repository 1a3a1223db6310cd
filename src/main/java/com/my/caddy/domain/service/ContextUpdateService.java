package com.my.caddy.domain.service;

import com.my.caddy.domain.exception.ContractViolationException;
import com.my.caddy.domain.model.ContextEvent;
import com.my.caddy.domain.model.RoundState;
import com.my.caddy.domain.port.in.UpdateContextUseCase;
import com.my.caddy.domain.port.out.PlayerDataPort;
import com.my.caddy.domain.session.SessionContext;
import com.my.caddy.domain.session.SessionRegistry;
import org.jboss.logging.Logger;

/**
 * 왜: 라운드 시작/홀 이동/종료와 선수 데이터 알림을 세션과 선수 데이터 저장소에 반영하기 위함.
 */
public class ContextUpdateService implements UpdateContextUseCase {

    private static final Logger log = Logger.getLogger(ContextUpdateService.class);

    private final SessionRegistry sessionRegistry;
    private final PlayerDataPort playerDataPort;

    public ContextUpdateService(SessionRegistry sessionRegistry, PlayerDataPort playerDataPort) {
        this.sessionRegistry = sessionRegistry;
        this.playerDataPort = playerDataPort;
    }

    @Override
    public void apply(ContextEvent event) {
        SessionContext session = sessionRegistry.session(event.userId());
        switch (event.type()) {
            case ROUND_START -> session.startRound(new RoundState(
                    required(event.roundId(), "roundId"),
                    event.courseName(),
                    event.hole() == null ? 1 : event.hole(),
                    event.par() == null ? 4 : event.par(),
                    0));
            case HOLE_UPDATE -> {
                if (session.round().isEmpty()) {
                    log.warnf("진행 중인 라운드 없이 홀 이동 이벤트 수신: eventId=%s", event.eventId());
                    return;
                }
                session.updateHole(
                        required(event.hole(), "hole"),
                        event.par() == null ? session.round().get().currentPar() : event.par());
            }
            case ROUND_END -> session.endRound();
            case RECOVERY_LOGGED -> playerDataPort.recordRecoveryData(event.userId());
            case BAG_CONFIGURED -> playerDataPort.markBagConfigured(event.userId());
        }
        log.debugf("컨텍스트 반영: eventId=%s, type=%s", event.eventId(), event.type());
    }

    private static <T> T required(T value, String name) {
        if (value == null) {
            throw new ContractViolationException("필수 값이 없습니다: " + name);
        }
        return value;
    }
}
