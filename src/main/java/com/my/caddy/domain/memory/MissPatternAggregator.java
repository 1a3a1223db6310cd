package com.my.caddy.domain.memory;

import com.my.caddy.domain.model.MissDirection;
import com.my.caddy.domain.model.MissEvent;
import com.my.caddy.domain.model.MissPattern;
import com.my.caddy.domain.model.PatternFilter;
import com.my.caddy.domain.model.PressureContext;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 왜: 미스 이벤트를 방향별 패턴으로 접어 감쇠된 신뢰도를 계산한다. 입력과 현재 시각만으로 결과가 정해진다.
 *
 * <p>신뢰도는 각 이벤트에 먼저 감쇠를 적용한 가중치 합을 필터된 전체 샷 수로 나눈 값이다.
 * 표본이 {@code minSamples} 미만이거나 비중이 {@code minShare} 미만인 방향, STRAIGHT, 신뢰도 0.01 미만 패턴은 버린다.
 */
public class MissPatternAggregator {

    public static final int DEFAULT_MIN_SAMPLES = 3;
    public static final double DEFAULT_MIN_SHARE = 0.30;
    public static final double MIN_REPORTED_CONFIDENCE = 0.01;

    /**
     * 신뢰도 내림차순, 표본 수 내림차순, 최근 발생 순, 방향 선언 순.
     */
    public static final Comparator<MissPattern> RANKING = Comparator
            .comparingDouble(MissPattern::confidence).reversed()
            .thenComparing(Comparator.comparingInt(MissPattern::frequency).reversed())
            .thenComparing(Comparator.comparing(MissPattern::lastOccurrence).reversed())
            .thenComparing(pattern -> pattern.direction().ordinal());

    private static final Comparator<MissEvent> NEWEST_FIRST = Comparator
            .comparing(MissEvent::timestamp).reversed()
            .thenComparing(MissEvent::id);

    private final DecayCalculator decayCalculator;
    private final int minSamples;
    private final double minShare;

    public MissPatternAggregator(DecayCalculator decayCalculator) {
        this(decayCalculator, DEFAULT_MIN_SAMPLES, DEFAULT_MIN_SHARE);
    }

    public MissPatternAggregator(DecayCalculator decayCalculator, int minSamples, double minShare) {
        this.decayCalculator = decayCalculator;
        this.minSamples = minSamples;
        this.minShare = minShare;
    }

    /**
     * 주어진 이벤트 전체를 하나의 분석 집합으로 본다.
     */
    public List<MissPattern> aggregate(List<MissEvent> events, Instant now) {
        return build(events, PatternFilter.all().key(), null, null, now);
    }

    /**
     * 필터(클럽, 압박 여부, 기간, 최대 개수)로 분석 집합을 고른 뒤 집계한다.
     */
    public List<MissPattern> aggregate(List<MissEvent> events, PatternFilter filter, Instant now) {
        List<MissEvent> selected = select(events, filter, now);
        PressureContext pressure = filter.pressureOnly() ? combinedPressure(selected) : null;
        return build(selected, filter.key(), filter.clubId(), pressure, now);
    }

    public List<MissEvent> select(List<MissEvent> events, PatternFilter filter, Instant now) {
        Instant since = now.minus(Duration.ofDays(filter.windowDays()));
        return events.stream()
                .filter(event -> filter.clubId() == null || filter.clubId().equals(event.clubId()))
                .filter(event -> !filter.pressureOnly() || event.pressureContext().hasPressure())
                .filter(event -> !event.timestamp().isBefore(since))
                .sorted(NEWEST_FIRST)
                .limit(filter.maxEvents())
                .toList();
    }

    private List<MissPattern> build(List<MissEvent> events,
                                    String filterKey,
                                    String clubId,
                                    PressureContext pressure,
                                    Instant now) {
        int total = events.size();
        if (total < minSamples) {
            return List.of();
        }
        Map<MissDirection, List<MissEvent>> byDirection = new EnumMap<>(MissDirection.class);
        for (MissEvent event : events) {
            if (event.missDirection().isMiss()) {
                byDirection.computeIfAbsent(event.missDirection(), ignored -> new ArrayList<>()).add(event);
            }
        }

        List<MissPattern> patterns = new ArrayList<>();
        byDirection.forEach((direction, group) -> {
            int frequency = group.size();
            if (frequency < minSamples || (double) frequency / total < minShare) {
                return;
            }
            double weight = 0.0;
            Instant last = group.get(0).timestamp();
            for (MissEvent event : group) {
                weight += decayCalculator.decay(event.timestamp(), now);
                if (event.timestamp().isAfter(last)) {
                    last = event.timestamp();
                }
            }
            double confidence = Math.min(1.0, weight / total);
            if (confidence < MIN_REPORTED_CONFIDENCE) {
                return;
            }
            patterns.add(new MissPattern(patternId(filterKey, direction), direction, frequency, confidence,
                    last, clubId, pressure));
        });
        patterns.sort(RANKING);
        return List.copyOf(patterns);
    }

    private static PressureContext combinedPressure(List<MissEvent> events) {
        boolean tagged = events.stream().anyMatch(event -> event.pressureContext().isUserTagged());
        boolean inferred = events.stream().anyMatch(event -> event.pressureContext().isInferred());
        return new PressureContext(tagged, inferred);
    }

    // 같은 필터와 방향이면 재집계해도 같은 ID가 나온다.
    static String patternId(String filterKey, MissDirection direction) {
        return UUID.nameUUIDFromBytes((filterKey + "#" + direction.name()).getBytes(StandardCharsets.UTF_8)).toString();
    }
}
