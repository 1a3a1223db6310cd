package com.my.caddy.domain.model;

/**
 * 왜: 목적지로 이동하기 전에 충족되어야 하는 데이터 조건을 이름으로 표현해 안내 메시지를 결정하기 위함.
 */
public enum Prerequisite {
    RECOVERY_DATA,
    ROUND_ACTIVE,
    BAG_CONFIGURED,
    COURSE_SELECTED
}
