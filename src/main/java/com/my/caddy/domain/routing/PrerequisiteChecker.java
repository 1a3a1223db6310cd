package com.my.caddy.domain.routing;

import com.my.caddy.domain.model.Prerequisite;

import java.util.List;

/**
 * 요구된 전제 조건 중 충족되지 않은 것만 돌려준다.
 */
@FunctionalInterface
public interface PrerequisiteChecker {

    List<Prerequisite> checkAll(List<Prerequisite> required);

    static PrerequisiteChecker allMet() {
        return required -> List.of();
    }
}
