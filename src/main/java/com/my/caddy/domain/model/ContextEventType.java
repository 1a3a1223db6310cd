package com.my.caddy.domain.model;

public enum ContextEventType {
    ROUND_START,
    HOLE_UPDATE,
    ROUND_END,
    RECOVERY_LOGGED,
    BAG_CONFIGURED
}
