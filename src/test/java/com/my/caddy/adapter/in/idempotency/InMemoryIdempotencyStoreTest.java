package com.my.caddy.adapter.in.idempotency;

import com.my.caddy.domain.port.out.ClockPort;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryIdempotencyStoreTest {

    private final AtomicReference<Instant> now = new AtomicReference<>(Instant.parse("2026-06-01T12:00:00Z"));
    private final ClockPort clock = () -> OffsetDateTime.ofInstant(now.get(), ZoneOffset.UTC);

    @Test
    void marked_event_is_processed_until_ttl_expires() {
        InMemoryIdempotencyStore store = new InMemoryIdempotencyStore(Duration.ofHours(24), clock);

        assertFalse(store.isProcessed("e1"));
        store.markProcessed("e1");
        assertTrue(store.isProcessed("e1"));

        now.set(now.get().plus(Duration.ofHours(24)));
        assertTrue(store.isProcessed("e1"));

        now.set(now.get().plusSeconds(1));
        assertFalse(store.isProcessed("e1"));
    }
}
