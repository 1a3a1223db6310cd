package com.my.caddy.adapter.in.rabbitmq;

import com.my.caddy.domain.exception.InvalidRequestException;
import com.my.caddy.domain.model.Lie;
import com.my.caddy.domain.model.MissDirection;
import com.my.caddy.domain.model.MissEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IncomingShotEventTest {

    @Test
    void normalizes_club_and_enums() {
        MissEvent event = new IncomingShotEvent("s1", "2026-06-01T21:00:00+09:00", " Driver ", "slice", "Tee",
                true, null, 7, "windy").toMissEvent();

        assertThat(event.clubId()).isEqualTo("driver");
        assertThat(event.missDirection()).isEqualTo(MissDirection.SLICE);
        assertThat(event.lie()).isEqualTo(Lie.TEE);
        assertThat(event.timestamp()).isEqualTo(Instant.parse("2026-06-01T12:00:00Z"));
        assertThat(event.pressureContext().isUserTagged()).isTrue();
        assertThat(event.pressureContext().isInferred()).isFalse();
    }

    @Test
    void out_of_range_hole_is_dropped() {
        MissEvent event = new IncomingShotEvent("s1", "2026-06-01T12:00:00Z", "driver", "HOOK", "ROUGH",
                null, null, 22, null).toMissEvent();

        assertThat(event.holeNumber()).isNull();
    }

    @Test
    void unknown_direction_is_invalid() {
        IncomingShotEvent incoming = new IncomingShotEvent("s1", "2026-06-01T12:00:00Z", "driver", "SHANKISH", "TEE",
                null, null, null, null);

        assertThatThrownBy(incoming::toMissEvent).isInstanceOf(InvalidRequestException.class);
    }
}
