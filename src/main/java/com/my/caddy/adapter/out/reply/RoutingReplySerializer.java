package com.my.caddy.adapter.out.reply;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.my.caddy.domain.model.Intent;
import com.my.caddy.domain.model.IntentType;
import com.my.caddy.domain.model.Prerequisite;
import com.my.caddy.domain.model.RoutingReply;
import com.my.caddy.domain.model.RoutingResult;
import com.my.caddy.domain.model.RoutingTarget;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 왜: 같은 결정은 항상 같은 바이트열이 되도록 키를 정렬한 JSON으로 직렬화한다.
 *
 * <p>결과 종류는 {@code type} 필드(NAVIGATE, NO_NAVIGATION, CONFIRMATION_REQUIRED, PREREQUISITE_MISSING)로 구분한다.
 */
public class RoutingReplySerializer {

    private final ObjectMapper objectMapper;

    public RoutingReplySerializer(ObjectMapper objectMapper) {
        this.objectMapper = JsonMapper.builder(objectMapper.getFactory())
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .build();
    }

    public String serialize(RoutingReply reply) throws JsonProcessingException {
        Map<String, Object> root = new TreeMap<>();
        root.put("eventId", reply.eventId());
        root.put("replyToUserId", reply.replyToUserId());
        if (reply.route() != null) {
            root.put("route", reply.route());
        }
        root.put("result", result(reply.result()));
        return objectMapper.writeValueAsString(root);
    }

    private static Map<String, Object> result(RoutingResult result) {
        Map<String, Object> node = new TreeMap<>();
        node.put("intent", intent(result.intent()));
        if (result instanceof RoutingResult.Navigate navigate) {
            node.put("type", "NAVIGATE");
            node.put("target", target(navigate.target()));
        } else if (result instanceof RoutingResult.NoNavigation noNavigation) {
            node.put("type", "NO_NAVIGATION");
            node.put("response", noNavigation.response());
        } else if (result instanceof RoutingResult.ConfirmationRequired confirmation) {
            node.put("type", "CONFIRMATION_REQUIRED");
            node.put("message", confirmation.message());
            node.put("suggestions", names(confirmation.suggestions()));
        } else if (result instanceof RoutingResult.PrerequisiteMissing missing) {
            node.put("type", "PREREQUISITE_MISSING");
            node.put("message", missing.message());
            node.put("missing", missing.missing().stream().map(Prerequisite::name).toList());
        }
        return node;
    }

    private static Map<String, Object> intent(Intent intent) {
        Map<String, Object> node = new TreeMap<>();
        node.put("id", intent.id());
        node.put("type", intent.type().name());
        node.put("confidence", intent.confidence());
        node.put("entities", intent.entities().toParameters());
        return node;
    }

    private static Map<String, Object> target(RoutingTarget target) {
        Map<String, Object> node = new TreeMap<>();
        node.put("module", target.module().name());
        node.put("screen", target.screen());
        node.put("parameters", target.parameters());
        return node;
    }

    private static List<String> names(List<IntentType> types) {
        return types.stream().map(IntentType::name).toList();
    }
}
