package com.my.caddy.domain.model;

/**
 * 라우팅 대상이 되는 앱의 최상위 모듈.
 */
public enum Module {
    CADDY,
    COACH,
    RECOVERY,
    SETTINGS
}
