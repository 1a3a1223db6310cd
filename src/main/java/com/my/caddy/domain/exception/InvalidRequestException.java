package com.my.caddy.domain.exception;

/**
 * 발화, 샷, 컨텍스트 메시지가 형식 계약을 어겼을 때. 인바운드 어댑터가 잡아 경고를 남기고 메시지를 확인 처리한다.
 */
public class InvalidRequestException extends RuntimeException {
    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
