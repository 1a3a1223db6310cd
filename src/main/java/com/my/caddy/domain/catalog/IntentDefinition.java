package com.my.caddy.domain.catalog;

import com.my.caddy.domain.model.IntentType;
import com.my.caddy.domain.model.Prerequisite;
import com.my.caddy.domain.model.RoutingTarget;

import java.util.List;
import java.util.Objects;

/**
 * 의도 하나의 정적 정의. {@code destination}이 없으면 화면 이동 없이 응답만 하는 의도다.
 */
public record IntentDefinition(
        IntentType type,
        String displayName,
        String description,
        String chipLabel,
        String confirmPhrase,
        RoutingTarget destination,
        List<Prerequisite> prerequisites,
        boolean offlineAvailable,
        String offlineLimitation
) {
    public IntentDefinition {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(displayName, "displayName");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(chipLabel, "chipLabel");
        Objects.requireNonNull(confirmPhrase, "confirmPhrase");
        Objects.requireNonNull(offlineLimitation, "offlineLimitation");
        prerequisites = prerequisites == null ? List.of() : List.copyOf(prerequisites);
    }

    public boolean navigable() {
        return destination != null;
    }
}
