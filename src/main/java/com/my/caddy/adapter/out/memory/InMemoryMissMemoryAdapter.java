package com.my.caddy.adapter.out.memory;

import com.my.caddy.domain.model.MissEvent;
import com.my.caddy.domain.model.MissPattern;
import com.my.caddy.domain.model.StoredPatterns;
import com.my.caddy.domain.port.out.MissMemoryPort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@IfBuildProperty(name = "app.memory.backend", stringValue = "memory")
@ApplicationScoped
public class InMemoryMissMemoryAdapter implements MissMemoryPort {

    private static final Comparator<MissEvent> NEWEST_FIRST = Comparator
            .comparing(MissEvent::timestamp).reversed()
            .thenComparing(MissEvent::id);

    private final Map<String, MissEvent> events = new LinkedHashMap<>();
    private final Map<String, StoredPatterns> patterns = new ConcurrentHashMap<>();

    @Override
    public synchronized void append(MissEvent event) {
        events.putIfAbsent(event.id(), event);
    }

    @Override
    public synchronized List<MissEvent> findEvents(String clubId, boolean pressureOnly, Instant since, int limit) {
        return events.values().stream()
                .filter(event -> !event.timestamp().isBefore(since))
                .filter(event -> clubId == null || clubId.equals(event.clubId()))
                .filter(event -> !pressureOnly || event.pressureContext().hasPressure())
                .sorted(NEWEST_FIRST)
                .limit(limit)
                .toList();
    }

    @Override
    public void replacePatterns(String filterKey, List<MissPattern> replacement, Instant refreshedAt) {
        if (replacement.isEmpty()) {
            patterns.remove(filterKey);
        } else {
            patterns.put(filterKey, new StoredPatterns(replacement, refreshedAt));
        }
    }

    @Override
    public Optional<StoredPatterns> findPatterns(String filterKey) {
        return Optional.ofNullable(patterns.get(filterKey));
    }

    @Override
    public synchronized int deleteEventsBefore(Instant cutoff) {
        int before = events.size();
        events.values().removeIf(event -> event.timestamp().isBefore(cutoff));
        return before - events.size();
    }

    @Override
    public synchronized void clear() {
        events.clear();
        patterns.clear();
    }
}
