package com.my.caddy.domain.model;

import com.my.caddy.domain.exception.ContractViolationException;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 왜: 목적지 모듈/화면/파라미터를 표현한다. 파라미터는 항상 키 사전순으로 정규화되어 삽입 순서와 무관하게 같은 값이 된다.
 */
public record RoutingTarget(Module module, String screen, SortedMap<String, Object> parameters) {

    public RoutingTarget {
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(screen, "screen");
        if (screen.isBlank()) {
            throw new ContractViolationException("RoutingTarget 화면 이름이 비어 있습니다.");
        }
        parameters = canonical(parameters);
    }

    public static RoutingTarget of(Module module, String screen, Map<String, ?> parameters) {
        return new RoutingTarget(module, screen, parameters == null ? null : new TreeMap<>(parameters));
    }

    public RoutingTarget withParameters(Map<String, ?> extra) {
        TreeMap<String, Object> merged = new TreeMap<>(parameters);
        merged.putAll(extra);
        return new RoutingTarget(module, screen, merged);
    }

    private static SortedMap<String, Object> canonical(Map<String, ?> source) {
        TreeMap<String, Object> sorted = new TreeMap<>();
        if (source != null) {
            source.forEach((key, value) -> {
                Objects.requireNonNull(key, "parameter key");
                sorted.put(key, scalar(key, value));
            });
        }
        return Collections.unmodifiableSortedMap(sorted);
    }

    private static Object scalar(String key, Object value) {
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        throw new ContractViolationException("파라미터는 스칼라 값이어야 합니다: " + key + "=" + value);
    }
}
