package com.my.caddy.domain.port.in;

import com.my.caddy.domain.model.ContextEvent;

/**
 * 왜: 라운드 진행과 선수 데이터 변경을 세션/선수 데이터에 반영해 전제 조건 판정이 최신 상태를 보도록 하기 위함.
 */
public interface UpdateContextUseCase {
    void apply(ContextEvent event);
}
