package com.my.caddy.domain.model;

public enum ModificationType {
    CASE,
    SLANG,
    NUMBER,
    PROFANITY
}
