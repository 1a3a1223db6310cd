package com.my.caddy.domain.offline;

import com.my.caddy.domain.model.ClarificationResponse;
import com.my.caddy.domain.model.Intent;
import com.my.caddy.domain.model.IntentType;

import java.util.Objects;

/**
 * 오프라인 키워드 매칭 결과.
 */
public sealed interface OfflineResult
        permits OfflineResult.Match, OfflineResult.Clarify, OfflineResult.RequiresOnline, OfflineResult.NoMatch {

    record Match(Intent intent) implements OfflineResult {
        public Match {
            Objects.requireNonNull(intent, "intent");
        }
    }

    record Clarify(ClarificationResponse clarification, double bestScore) implements OfflineResult {
        public Clarify {
            Objects.requireNonNull(clarification, "clarification");
        }
    }

    record RequiresOnline(IntentType intentType, String message) implements OfflineResult {
        public RequiresOnline {
            Objects.requireNonNull(intentType, "intentType");
            Objects.requireNonNull(message, "message");
        }
    }

    record NoMatch(String message) implements OfflineResult {
        public NoMatch {
            Objects.requireNonNull(message, "message");
        }
    }
}
