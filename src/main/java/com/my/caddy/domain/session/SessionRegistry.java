package com.my.caddy.domain.session;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 사용자별 세션. 처음 조회할 때 만든다.
 */
public class SessionRegistry {

    private final Map<String, SessionContext> sessions = new ConcurrentHashMap<>();
    private final int capacity;

    public SessionRegistry(int capacity) {
        this.capacity = capacity;
    }

    public SessionContext session(String userId) {
        return sessions.computeIfAbsent(userId, ignored -> new SessionContext(capacity));
    }

    public Optional<SessionContext> existing(String userId) {
        return Optional.ofNullable(sessions.get(userId));
    }
}
