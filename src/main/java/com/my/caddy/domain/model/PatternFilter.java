package com.my.caddy.domain.model;

/**
 * 패턴 조회 범위. {@link #key()}는 저장된 패턴을 통째로 교체할 때의 식별자이며 기간과 최대 개수까지 포함한다.
 */
public record PatternFilter(String clubId, boolean pressureOnly, int windowDays, int maxEvents) {

    public static final int DEFAULT_WINDOW_DAYS = 30;
    public static final int DEFAULT_MAX_EVENTS = 50;

    public PatternFilter {
        if (clubId != null && clubId.isBlank()) {
            clubId = null;
        }
        if (windowDays <= 0) {
            windowDays = DEFAULT_WINDOW_DAYS;
        }
        if (maxEvents <= 0) {
            maxEvents = DEFAULT_MAX_EVENTS;
        }
    }

    public static PatternFilter all() {
        return new PatternFilter(null, false, DEFAULT_WINDOW_DAYS, DEFAULT_MAX_EVENTS);
    }

    public static PatternFilter forClub(String clubId) {
        return new PatternFilter(clubId, false, DEFAULT_WINDOW_DAYS, DEFAULT_MAX_EVENTS);
    }

    public static PatternFilter underPressure() {
        return new PatternFilter(null, true, DEFAULT_WINDOW_DAYS, DEFAULT_MAX_EVENTS);
    }

    public PatternFilter withWindow(int days, int limit) {
        return new PatternFilter(clubId, pressureOnly, days, limit);
    }

    public String key() {
        return "club=" + (clubId == null ? "*" : clubId) + "|pressure=" + pressureOnly
                + "|window=" + windowDays + "|max=" + maxEvents;
    }
}
