package com.my.caddy.adapter.in.idempotency;

import com.my.caddy.config.AppConfig;
import com.my.caddy.domain.port.out.ClockPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 처리한 발화 ID를 TTL 동안 기억한다. 만료 판정은 {@link ClockPort} 기준이다.
 */
@ApplicationScoped
public class InMemoryIdempotencyStore implements IdempotencyStore {

    private final Duration ttl;
    private final ClockPort clockPort;
    private final Map<String, Instant> processedAt = new ConcurrentHashMap<>();

    @Inject
    public InMemoryIdempotencyStore(AppConfig appConfig, ClockPort clockPort) {
        this(Duration.ofHours(appConfig.idempotency().ttlHours()), clockPort);
    }

    InMemoryIdempotencyStore(Duration ttl, ClockPort clockPort) {
        this.ttl = ttl;
        this.clockPort = clockPort;
    }

    @Override
    public boolean isProcessed(String eventId) {
        Instant seen = processedAt.get(eventId);
        if (seen == null) {
            return false;
        }
        if (seen.isBefore(cutoff())) {
            processedAt.remove(eventId, seen);
            return false;
        }
        return true;
    }

    @Override
    public void markProcessed(String eventId) {
        Instant cutoff = cutoff();
        processedAt.values().removeIf(seen -> seen.isBefore(cutoff));
        processedAt.put(eventId, clockPort.now().toInstant());
    }

    private Instant cutoff() {
        return clockPort.now().toInstant().minus(ttl);
    }
}
