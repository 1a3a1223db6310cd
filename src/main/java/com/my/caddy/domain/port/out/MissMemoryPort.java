package com.my.caddy.domain.port.out;

import com.my.caddy.domain.model.MissEvent;
import com.my.caddy.domain.model.MissPattern;
import com.my.caddy.domain.model.StoredPatterns;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 왜: 미스 이벤트와 파생 패턴의 저장소를 추상화하여 SQLite/인메모리 구현을 교체 가능하게 하기 위함.
 */
public interface MissMemoryPort {

    void append(MissEvent event);

    /**
     * 최신순으로 최대 {@code limit}개. {@code clubId}가 null이면 모든 클럽.
     */
    List<MissEvent> findEvents(String clubId, boolean pressureOnly, Instant since, int limit);

    void replacePatterns(String filterKey, List<MissPattern> patterns, Instant refreshedAt);

    /**
     * 해당 키로 저장된 패턴이 하나도 없으면 비어 있다.
     */
    Optional<StoredPatterns> findPatterns(String filterKey);

    int deleteEventsBefore(Instant cutoff);

    void clear();
}
