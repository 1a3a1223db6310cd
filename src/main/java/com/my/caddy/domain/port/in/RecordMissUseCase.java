package com.my.caddy.domain.port.in;

import com.my.caddy.domain.model.MissEvent;

public interface RecordMissUseCase {
    void record(MissEvent event);
}
