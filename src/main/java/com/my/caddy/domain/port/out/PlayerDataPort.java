package com.my.caddy.domain.port.out;

/**
 * 선수별 회복 데이터와 백 구성 여부.
 */
public interface PlayerDataPort {

    boolean hasRecoveryData(String userId);

    boolean hasBagConfigured(String userId);

    void recordRecoveryData(String userId);

    void markBagConfigured(String userId);
}
