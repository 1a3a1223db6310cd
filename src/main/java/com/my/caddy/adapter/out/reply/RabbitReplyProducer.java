package com.my.caddy.adapter.out.reply;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.caddy.domain.model.RoutingReply;
import com.my.caddy.domain.port.out.ReplyPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Channel;
import org.eclipse.microprofile.reactive.messaging.Emitter;
import org.jboss.logging.Logger;

/**
 * 왜: 라우팅 결정을 RabbitMQ로 전달하는 기술적 구현을 분리하여 포트 계약을 지키기 위함.
 */
@ApplicationScoped
public class RabbitReplyProducer implements ReplyPort {

    private static final Logger log = Logger.getLogger(RabbitReplyProducer.class);

    private final Emitter<String> replyEmitter;
    private final RoutingReplySerializer serializer;

    @Inject
    public RabbitReplyProducer(@Channel("caddy-replies") Emitter<String> replyEmitter, ObjectMapper objectMapper) {
        this.replyEmitter = replyEmitter;
        this.serializer = new RoutingReplySerializer(objectMapper);
    }

    @Override
    public void send(RoutingReply reply) {
        try {
            replyEmitter.send(serializer.serialize(reply));
        } catch (JsonProcessingException e) {
            log.warnf("라우팅 응답 직렬화 실패: eventId=%s, %s", reply.eventId(), e.getMessage());
        }
    }
}
