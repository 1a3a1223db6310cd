package com.my.caddy.domain.routing;

import com.my.caddy.domain.model.Intent;

/**
 * 화면 이동이 없는 의도에 대한 응답 문장.
 */
public interface ResponseComposer {
    String compose(Intent intent);
}
