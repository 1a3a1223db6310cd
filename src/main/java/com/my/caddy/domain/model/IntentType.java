package com.my.caddy.domain.model;

/**
 * 왜: 분류기가 판정할 수 있는 사용자 의도를 닫힌 집합으로 고정하여 라우팅 분기 기준을 단순화하기 위함.
 */
public enum IntentType {
    CLUB_ADJUSTMENT,
    RECOVERY_CHECK,
    SHOT_RECOMMENDATION,
    SCORE_ENTRY,
    PATTERN_QUERY,
    DRILL_REQUEST,
    WEATHER_CHECK,
    STATS_LOOKUP,
    ROUND_START,
    ROUND_END,
    EQUIPMENT_INFO,
    COURSE_INFO,
    SETTINGS_CHANGE,
    HELP_REQUEST,
    FEEDBACK,
    BAILOUT_QUERY,
    READINESS_CHECK
}
