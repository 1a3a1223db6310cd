package com.my.caddy.domain.exception;

/**
 * 왜: 원격 분류기 연결 실패를 도메인 언어로 표현해 분류기가 오프라인 경로로 한 번만 전환하도록 하기 위함.
 */
public class ClassifierUnavailableException extends RuntimeException {
    public ClassifierUnavailableException(String message) {
        super(message);
    }

    public ClassifierUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
