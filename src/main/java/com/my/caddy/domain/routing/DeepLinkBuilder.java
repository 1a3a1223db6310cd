package com.my.caddy.domain.routing;

import com.my.caddy.domain.catalog.IntentCatalog;
import com.my.caddy.domain.exception.ContractViolationException;
import com.my.caddy.domain.model.RoutingTarget;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 왜: 같은 목적지는 파라미터 삽입 순서와 무관하게 항상 같은 경로 문자열이 되도록 고정하기 위함.
 *
 * <p>형식: {@code module/screen?k1=v1&k2=v2}. 키는 사전순, 키와 값은 URL 인코딩한다.
 */
public class DeepLinkBuilder {

    private final IntentCatalog catalog;

    public DeepLinkBuilder(IntentCatalog catalog) {
        this.catalog = catalog;
    }

    public String buildRoute(RoutingTarget target) {
        if (!catalog.screens(target.module()).contains(target.screen())) {
            throw new ContractViolationException(
                    "알 수 없는 화면입니다: " + target.module() + "/" + target.screen());
        }
        String path = target.module().name().toLowerCase(Locale.ROOT) + "/" + target.screen();
        if (target.parameters().isEmpty()) {
            return path;
        }
        String query = target.parameters().entrySet().stream()
                .map(entry -> encode(entry.getKey()) + "=" + encode(String.valueOf(entry.getValue())))
                .collect(Collectors.joining("&"));
        return path + "?" + query;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
