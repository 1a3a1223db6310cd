package com.my.caddy.domain.model;

import java.util.Objects;

/**
 * 왜: 분류 결과를 라우팅 가능 여부 기준의 세 단계(Route/Confirm/Clarify)로 고정해 온라인/오프라인 경로가 같은 계약을 따르게 하기 위함.
 */
public sealed interface ClassificationVerdict
        permits ClassificationVerdict.Route, ClassificationVerdict.Confirm, ClassificationVerdict.Clarify {

    ClassificationSource source();

    record Route(Intent intent, ClassificationSource source) implements ClassificationVerdict {
        public Route {
            Objects.requireNonNull(intent, "intent");
            Objects.requireNonNull(source, "source");
        }
    }

    record Confirm(Intent intent, String message, ClassificationSource source) implements ClassificationVerdict {
        public Confirm {
            Objects.requireNonNull(intent, "intent");
            Objects.requireNonNull(message, "message");
            Objects.requireNonNull(source, "source");
        }
    }

    /**
     * {@code bestGuess}는 가장 점수가 높았던 후보(없으면 신뢰도 0의 도움말 의도)다.
     */
    record Clarify(Intent bestGuess, ClarificationResponse clarification, ClassificationSource source)
            implements ClassificationVerdict {
        public Clarify {
            Objects.requireNonNull(bestGuess, "bestGuess");
            Objects.requireNonNull(clarification, "clarification");
            Objects.requireNonNull(source, "source");
        }
    }
}
