package com.my.caddy.adapter.in.idempotency;

/**
 * 같은 발화 이벤트가 재전달돼도 응답을 한 번만 내보내기 위한 처리 이력.
 */
public interface IdempotencyStore {

    boolean isProcessed(String eventId);

    void markProcessed(String eventId);
}
