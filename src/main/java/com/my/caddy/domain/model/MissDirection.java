package com.my.caddy.domain.model;

/**
 * 샷 결과 방향. STRAIGHT는 기록만 되고 패턴으로 집계되지 않는다.
 */
public enum MissDirection {
    PUSH,
    PULL,
    SLICE,
    HOOK,
    FAT,
    THIN,
    STRAIGHT;

    public boolean isMiss() {
        return this != STRAIGHT;
    }
}
