package com.my.caddy.adapter.in.scheduler;

import com.my.caddy.config.AppConfig;
import com.my.caddy.domain.model.MissPattern;
import com.my.caddy.domain.port.in.QueryPatternsUseCase;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 왜: 보관 기간이 지난 미스 이벤트를 지우고 전체 클럽 패턴을 다시 구체화하는 주기 작업이 필요하기 때문.
 */
@Startup
@ApplicationScoped
public class MemoryMaintenanceScheduler {

    private static final Logger log = Logger.getLogger(MemoryMaintenanceScheduler.class);

    private final QueryPatternsUseCase queryPatternsUseCase;
    private final int intervalMinutes;
    private final ScheduledExecutorService executor;

    @Inject
    public MemoryMaintenanceScheduler(QueryPatternsUseCase queryPatternsUseCase, AppConfig appConfig) {
        this.queryPatternsUseCase = queryPatternsUseCase;
        this.intervalMinutes = appConfig.memory().maintenanceIntervalMinutes();
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "memory-maintenance");
            thread.setDaemon(true);
            return thread;
        });
    }

    @PostConstruct
    void start() {
        executor.scheduleWithFixedDelay(this::maintainSafely, 0, intervalMinutes, TimeUnit.MINUTES);
    }

    void maintainSafely() {
        try {
            int deleted = queryPatternsUseCase.enforceRetention();
            List<MissPattern> refreshed = queryPatternsUseCase.refresh(queryPatternsUseCase.filter(null, false));
            log.debugf("미스 기억 정리 완료: deleted=%d, patterns=%d", deleted, refreshed.size());
        } catch (Exception e) {
            log.warnf("미스 기억 정리 중 예외: %s", e.getMessage());
        }
    }

    @PreDestroy
    void stop() {
        executor.shutdownNow();
    }
}
