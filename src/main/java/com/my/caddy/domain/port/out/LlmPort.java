package com.my.caddy.domain.port.out;

import com.my.caddy.domain.model.LlmIntentResult;
import com.my.caddy.domain.model.SessionSnapshot;

/**
 * 왜: LLM 호출을 추상화하여 도메인이 공급자나 프로토콜에 의존하지 않도록 하기 위함.
 *
 * <p>구현은 연결 실패 시 {@code ClassifierUnavailableException}, 해석 불가능한 응답에는 {@code IntentParseException}을 던진다.
 */
public interface LlmPort {
    LlmIntentResult classify(String normalizedText, SessionSnapshot context);
}
