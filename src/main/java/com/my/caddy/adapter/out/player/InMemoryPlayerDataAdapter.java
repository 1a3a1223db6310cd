package com.my.caddy.adapter.out.player;

import com.my.caddy.domain.port.out.PlayerDataPort;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 왜: 회복 데이터와 백 구성 여부는 컨텍스트 이벤트로만 들어오므로 프로세스 메모리에 사용자 ID 집합으로 둔다.
 */
@ApplicationScoped
public class InMemoryPlayerDataAdapter implements PlayerDataPort {

    private final Set<String> recoveryLogged = ConcurrentHashMap.newKeySet();
    private final Set<String> bagConfigured = ConcurrentHashMap.newKeySet();

    @Override
    public boolean hasRecoveryData(String userId) {
        return recoveryLogged.contains(userId);
    }

    @Override
    public boolean hasBagConfigured(String userId) {
        return bagConfigured.contains(userId);
    }

    @Override
    public void recordRecoveryData(String userId) {
        recoveryLogged.add(userId);
    }

    @Override
    public void markBagConfigured(String userId) {
        bagConfigured.add(userId);
    }
}
