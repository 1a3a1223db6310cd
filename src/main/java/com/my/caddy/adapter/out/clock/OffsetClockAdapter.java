package com.my.caddy.adapter.out.clock;

import com.my.caddy.domain.port.out.ClockPort;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;

/**
 * 왜: 시스템 시간을 주입형으로 제공해 감쇠/보존 계산과 테스트가 같은 시계를 보도록 하기 위함.
 */
public class OffsetClockAdapter implements ClockPort {

    private final Clock clock;

    private OffsetClockAdapter(Clock clock) {
        this.clock = clock;
    }

    public static OffsetClockAdapter of(ZoneId zoneId) {
        return new OffsetClockAdapter(Clock.system(zoneId));
    }

    public static OffsetClockAdapter fixed(Instant instant, ZoneId zoneId) {
        return new OffsetClockAdapter(Clock.fixed(instant, zoneId));
    }

    @Override
    public OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
