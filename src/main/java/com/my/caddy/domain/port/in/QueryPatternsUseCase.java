package com.my.caddy.domain.port.in;

import com.my.caddy.domain.model.MissPattern;
import com.my.caddy.domain.model.PatternFilter;

import java.util.List;
import java.util.Optional;

/**
 * 미스 패턴 조회와 기억 관리. 현재 시각은 구현이 시계 포트에서 읽는다.
 */
public interface QueryPatternsUseCase {

    PatternFilter filter(String clubId, boolean pressureOnly);

    List<MissPattern> patterns(PatternFilter filter);

    Optional<MissPattern> dominantPattern(PatternFilter filter);

    List<MissPattern> refresh(PatternFilter filter);

    List<MissPattern> storedPatterns(PatternFilter filter);

    int enforceRetention();

    void clearHistory();
}
