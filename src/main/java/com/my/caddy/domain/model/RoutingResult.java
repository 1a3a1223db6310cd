package com.my.caddy.domain.model;

import com.my.caddy.domain.exception.ContractViolationException;

import java.util.List;
import java.util.Objects;

/**
 * 왜: 한 번의 호출이 정확히 하나의 결과 형태만 갖도록 닫힌 태그 유니온으로 표현하기 위함.
 */
public sealed interface RoutingResult
        permits RoutingResult.Navigate, RoutingResult.NoNavigation,
        RoutingResult.ConfirmationRequired, RoutingResult.PrerequisiteMissing {

    Intent intent();

    record Navigate(RoutingTarget target, Intent intent) implements RoutingResult {
        public Navigate {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(intent, "intent");
        }
    }

    record NoNavigation(Intent intent, String response) implements RoutingResult {
        public NoNavigation {
            Objects.requireNonNull(intent, "intent");
            Objects.requireNonNull(response, "response");
        }
    }

    /**
     * 확인 질문 또는 되묻기. 되묻기일 때만 {@code suggestions}가 채워진다.
     */
    record ConfirmationRequired(Intent intent, String message, List<IntentType> suggestions) implements RoutingResult {
        public ConfirmationRequired {
            Objects.requireNonNull(intent, "intent");
            Objects.requireNonNull(message, "message");
            suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        }
    }

    record PrerequisiteMissing(Intent intent, List<Prerequisite> missing, String message) implements RoutingResult {
        public PrerequisiteMissing {
            Objects.requireNonNull(intent, "intent");
            Objects.requireNonNull(message, "message");
            missing = missing == null ? List.of() : List.copyOf(missing);
            if (missing.isEmpty()) {
                throw new ContractViolationException("누락된 전제 조건이 최소 하나는 있어야 합니다.");
            }
        }
    }
}
