package com.my.caddy.domain.model;

public enum Lie {
    TEE,
    FAIRWAY,
    ROUGH,
    BUNKER,
    GREEN,
    FRINGE,
    HAZARD
}
