package com.my.caddy.domain.model;

import java.util.Objects;

public record IntentSuggestion(IntentType intentType, String label, String description) {
    public IntentSuggestion {
        Objects.requireNonNull(intentType, "intentType");
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(description, "description");
    }
}
