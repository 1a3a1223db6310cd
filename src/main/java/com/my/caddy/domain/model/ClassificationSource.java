package com.my.caddy.domain.model;

public enum ClassificationSource {
    ONLINE,
    OFFLINE
}
