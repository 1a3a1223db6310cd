package com.my.caddy.domain.exception;

/**
 * 왜: 미래 시각이나 범위를 벗어난 신뢰도처럼 호출자 버그에 해당하는 입력을 런타임 상황과 구분해 즉시 실패시키기 위함.
 */
public class ContractViolationException extends RuntimeException {
    public ContractViolationException(String message) {
        super(message);
    }
}
