package com.my.caddy.domain.model;

/**
 * 되묻기 메시지의 고정 문구 단계. 같은 단계는 항상 같은 문구를 쓴다.
 */
public enum ClarificationTier {
    EMPTY_INPUT("Please say or type something. Did you mean:"),
    NEAR_MISS("I'm not quite sure what you're asking. Did you want to:"),
    UNCLEAR("I'm not quite sure what you need. Did you mean:"),
    OFFLINE_WEAK("I'm offline and need a bit more clarity. Did you mean:"),
    REQUIRES_ONLINE("This feature needs an internet connection. You can still enter scores, check stats, "
            + "or view your equipment."),
    OFFLINE_NO_MATCH("I'm offline and didn't understand that. You're offline. I can help with scores, stats, "
            + "equipment, and settings. Full features will be back when you reconnect.");

    private final String message;

    ClarificationTier(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
