package com.my.caddy.domain.port.out;

import com.my.caddy.domain.model.Prerequisite;

import java.util.List;

/**
 * 왜: 전제 조건 판정에 필요한 세션/선수 데이터 조회를 라우팅 로직에서 분리하기 위함.
 */
public interface PrerequisitePort {

    /**
     * @return {@code required} 중 충족되지 않은 항목, 입력 순서 유지
     */
    List<Prerequisite> unmet(String userId, List<Prerequisite> required);
}
