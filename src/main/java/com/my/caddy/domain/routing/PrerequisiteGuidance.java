package com.my.caddy.domain.routing;

import com.my.caddy.domain.model.Prerequisite;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 누락된 전제 조건별 안내 문구. 여러 개면 선언 순서대로 이어 붙인다.
 */
public final class PrerequisiteGuidance {

    private PrerequisiteGuidance() {
    }

    public static String message(Prerequisite prerequisite) {
        return switch (prerequisite) {
            case RECOVERY_DATA -> "I don't have any recovery data yet. Log your sleep, HRV, or readiness score first, "
                    + "and I'll give you insights.";
            case ROUND_ACTIVE -> "You need to start a round first. Would you like to start a new round now?";
            case BAG_CONFIGURED -> "Your bag isn't configured yet. Set up your clubs and distances so I can give you "
                    + "better recommendations.";
            case COURSE_SELECTED -> "Which course are you playing? Select a course to get specific information.";
        };
    }

    public static String message(List<Prerequisite> missing) {
        return missing.stream()
                .sorted()
                .map(PrerequisiteGuidance::message)
                .collect(Collectors.joining(" "));
    }
}
