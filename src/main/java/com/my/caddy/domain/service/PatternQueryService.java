package com.my.caddy.domain.service;

import com.my.caddy.domain.memory.MissPatternStore;
import com.my.caddy.domain.model.MissPattern;
import com.my.caddy.domain.model.PatternFilter;
import com.my.caddy.domain.port.in.QueryPatternsUseCase;
import com.my.caddy.domain.port.out.ClockPort;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public class PatternQueryService implements QueryPatternsUseCase {

    private static final Logger log = Logger.getLogger(PatternQueryService.class);

    private final MissPatternStore patternStore;
    private final ClockPort clockPort;

    public PatternQueryService(MissPatternStore patternStore, ClockPort clockPort) {
        this.patternStore = patternStore;
        this.clockPort = clockPort;
    }

    @Override
    public PatternFilter filter(String clubId, boolean pressureOnly) {
        return patternStore.filter(clubId, pressureOnly);
    }

    @Override
    public List<MissPattern> patterns(PatternFilter filter) {
        return patternStore.patterns(filter, now());
    }

    @Override
    public Optional<MissPattern> dominantPattern(PatternFilter filter) {
        return patternStore.dominantPattern(filter, now());
    }

    @Override
    public List<MissPattern> refresh(PatternFilter filter) {
        List<MissPattern> patterns = patternStore.refresh(filter, now());
        log.infof("패턴 재계산: key=%s, count=%d", filter.key(), patterns.size());
        return patterns;
    }

    @Override
    public List<MissPattern> storedPatterns(PatternFilter filter) {
        return patternStore.storedPatterns(filter, now());
    }

    @Override
    public int enforceRetention() {
        int deleted = patternStore.enforceRetention(now());
        if (deleted > 0) {
            log.infof("보존 기간이 지난 미스 이벤트 삭제: %d건", deleted);
        }
        return deleted;
    }

    @Override
    public void clearHistory() {
        patternStore.clearHistory();
        log.info("미스 기록 전체 삭제");
    }

    private Instant now() {
        return clockPort.now().toInstant();
    }
}
