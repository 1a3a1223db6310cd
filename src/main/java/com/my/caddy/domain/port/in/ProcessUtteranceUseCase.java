package com.my.caddy.domain.port.in;

import com.my.caddy.domain.model.RoutingResult;
import com.my.caddy.domain.model.UtteranceRequest;

/**
 * 왜: 발화 하나를 정규화부터 라우팅까지 단일 진입점으로 처리해 모든 입력이 정확히 하나의 라우팅 결과를 갖도록 하기 위함.
 */
public interface ProcessUtteranceUseCase {
    RoutingResult process(UtteranceRequest request);
}
