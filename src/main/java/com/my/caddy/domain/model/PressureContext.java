package com.my.caddy.domain.model;

/**
 * 왜: 사용자가 직접 표시한 압박 상황과 스코어 맥락에서 추론한 압박 상황을 구분해 패턴 필터에 쓰기 위함.
 */
public record PressureContext(boolean isUserTagged, boolean isInferred) {

    public static final PressureContext NONE = new PressureContext(false, false);

    public boolean hasPressure() {
        return isUserTagged || isInferred;
    }
}
