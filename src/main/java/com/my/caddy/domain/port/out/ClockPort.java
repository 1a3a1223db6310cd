package com.my.caddy.domain.port.out;

import java.time.OffsetDateTime;

public interface ClockPort {
    OffsetDateTime now();
}
