package com.my.caddy.domain.memory;

import com.my.caddy.domain.model.MissEvent;
import com.my.caddy.domain.model.MissPattern;
import com.my.caddy.domain.model.PatternFilter;
import com.my.caddy.domain.model.StoredPatterns;
import com.my.caddy.domain.port.out.MissMemoryPort;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 왜: 이벤트 기록, 패턴 조회/재계산, 보존 정책을 한 객체로 묶어 저장소 구현과 집계 규칙을 분리하기 위함.
 *
 * <p>저장된 패턴은 구체화 뷰다. {@link #refresh}가 같은 필터 키의 이전 패턴을 재계산 시각과 함께 통째로 교체한다.
 */
public class MissPatternStore {

    private final MissMemoryPort memoryPort;
    private final MissPatternAggregator aggregator;
    private final DecayCalculator decayCalculator;
    private final int windowDays;
    private final int maxEvents;

    public MissPatternStore(MissMemoryPort memoryPort,
                            MissPatternAggregator aggregator,
                            DecayCalculator decayCalculator,
                            int windowDays,
                            int maxEvents) {
        this.memoryPort = memoryPort;
        this.aggregator = aggregator;
        this.decayCalculator = decayCalculator;
        this.windowDays = windowDays;
        this.maxEvents = maxEvents;
    }

    public void record(MissEvent event) {
        Objects.requireNonNull(event, "event");
        memoryPort.append(event);
    }

    /**
     * 설정된 기본 기간과 최대 개수를 쓰는 필터.
     */
    public PatternFilter filter(String clubId, boolean pressureOnly) {
        return new PatternFilter(clubId, pressureOnly, windowDays, maxEvents);
    }

    public List<MissPattern> patterns(PatternFilter filter, Instant now) {
        Instant since = now.minus(Duration.ofDays(filter.windowDays()));
        List<MissEvent> events = memoryPort.findEvents(filter.clubId(), filter.pressureOnly(), since, filter.maxEvents());
        return aggregator.aggregate(events, filter, now);
    }

    public Optional<MissPattern> dominantPattern(PatternFilter filter, Instant now) {
        return patterns(filter, now).stream().findFirst();
    }

    public List<MissPattern> refresh(PatternFilter filter, Instant now) {
        List<MissPattern> patterns = patterns(filter, now);
        memoryPort.replacePatterns(filter.key(), patterns, now);
        return patterns;
    }

    /**
     * 저장된 신뢰도는 재계산 시점까지 이미 감쇠되어 있으므로, 그 이후 흐른 시간만큼만 더 감쇠한다.
     * 거의 사라진 패턴은 뺀다.
     */
    public List<MissPattern> storedPatterns(PatternFilter filter, Instant now) {
        return memoryPort.findPatterns(filter.key())
                .map(stored -> sinceRefresh(stored, now))
                .orElse(List.of());
    }

    private List<MissPattern> sinceRefresh(StoredPatterns stored, Instant now) {
        // 재계산 시각보다 이른 조회는 추가 감쇠 없이 읽는다.
        Instant from = stored.refreshedAt().isAfter(now) ? now : stored.refreshedAt();
        return stored.patterns().stream()
                .map(pattern -> pattern.withConfidence(
                        decayCalculator.decayedConfidence(pattern.confidence(), from, now)))
                .filter(pattern -> pattern.confidence() >= MissPatternAggregator.MIN_REPORTED_CONFIDENCE)
                .sorted(MissPatternAggregator.RANKING)
                .toList();
    }

    public int enforceRetention(Instant now) {
        return memoryPort.deleteEventsBefore(decayCalculator.retentionCutoff(now));
    }

    public void clearHistory() {
        memoryPort.clear();
    }
}
