package com.my.caddy.domain.model;

public enum Role {
    USER,
    ASSISTANT
}
