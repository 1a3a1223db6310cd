package com.my.caddy.domain.port.out;

import com.my.caddy.domain.model.RoutingReply;

/**
 * 왜: 응답 채널(RabbitMQ 등) 세부 구현을 숨기고 도메인이 단일 계약으로 라우팅 결정을 내보내도록 하기 위함.
 */
public interface ReplyPort {
    void send(RoutingReply reply);
}
