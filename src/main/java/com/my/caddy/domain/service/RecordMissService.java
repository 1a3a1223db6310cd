package com.my.caddy.domain.service;

import com.my.caddy.domain.exception.ContractViolationException;
import com.my.caddy.domain.memory.MissPatternStore;
import com.my.caddy.domain.model.MissEvent;
import com.my.caddy.domain.port.in.RecordMissUseCase;
import com.my.caddy.domain.port.out.ClockPort;

/**
 * 샷 기록기가 보낸 미스 이벤트를 추가한다. 이벤트는 한 번 쓰이고 수정되지 않는다.
 */
public class RecordMissService implements RecordMissUseCase {

    private final MissPatternStore patternStore;
    private final ClockPort clockPort;

    public RecordMissService(MissPatternStore patternStore, ClockPort clockPort) {
        this.patternStore = patternStore;
        this.clockPort = clockPort;
    }

    @Override
    public void record(MissEvent event) {
        if (event.timestamp().isAfter(clockPort.now().toInstant())) {
            throw new ContractViolationException("미래 시각의 미스 이벤트는 기록할 수 없습니다: " + event.id());
        }
        patternStore.record(event);
    }
}
