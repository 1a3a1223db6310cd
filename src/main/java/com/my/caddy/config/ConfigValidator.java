package com.my.caddy.config;

import io.quarkus.runtime.Startup;
import io.quarkus.runtime.configuration.ConfigUtils;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

@Startup
@ApplicationScoped
public class ConfigValidator {

    private static final Logger log = Logger.getLogger(ConfigValidator.class);

    private final AppConfig appConfig;

    public ConfigValidator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    void validate() {
        boolean isProd = ConfigUtils.isProfileActive("prod");
        validateRequired("OPENAI_API_KEY", appConfig.openai().apiKey().orElse(null), isProd);
        List<String> problems = problems(appConfig);
        for (String problem : problems) {
            if (isProd) {
                throw new IllegalStateException(problem);
            }
            log.warn(problem);
        }
    }

    /**
     * 임계값, 기간, 시간대 설정의 모순을 찾는다.
     */
    static List<String> problems(AppConfig config) {
        List<String> problems = new ArrayList<>();
        AppConfig.ClassifierConfig classifier = config.classifier();
        if (!inUnitRange(classifier.routeThreshold()) || !inUnitRange(classifier.confirmThreshold())
                || classifier.confirmThreshold() >= classifier.routeThreshold()) {
            problems.add("분류 임계값이 올바르지 않습니다: confirm=" + classifier.confirmThreshold()
                    + ", route=" + classifier.routeThreshold());
        }
        AppConfig.OfflineConfig offline = config.offline();
        if (!inUnitRange(offline.strongThreshold()) || !inUnitRange(offline.weakThreshold())
                || offline.weakThreshold() >= offline.strongThreshold()) {
            problems.add("오프라인 임계값이 올바르지 않습니다: weak=" + offline.weakThreshold()
                    + ", strong=" + offline.strongThreshold());
        }
        if (classifier.textTimeoutMs() <= 0 || classifier.voiceTimeoutMs() <= 0) {
            problems.add("분류 타임아웃은 양수여야 합니다.");
        }
        AppConfig.MemoryConfig memory = config.memory();
        if (memory.halfLifeDays() <= 0 || memory.retentionDays() <= 0 || memory.windowDays() <= 0
                || memory.maxEvents() <= 0 || memory.minSamples() <= 0 || !inUnitRange(memory.minShare())
                || memory.maintenanceIntervalMinutes() <= 0) {
            problems.add("미스 기억 설정이 올바르지 않습니다.");
        }
        if (config.session().historyCapacity() <= 0) {
            problems.add("세션 용량은 양수여야 합니다: " + config.session().historyCapacity());
        }
        if (config.idempotency().ttlHours() <= 0) {
            problems.add("중복 판정 보관 시간은 양수여야 합니다: " + config.idempotency().ttlHours());
        }
        try {
            ZoneId.of(config.clock().zone());
        } catch (DateTimeException e) {
            problems.add("시간대 설정이 올바르지 않습니다: " + config.clock().zone());
        }
        return problems;
    }

    private static boolean inUnitRange(double value) {
        return value >= 0.0 && value <= 1.0;
    }

    private void validateRequired(String name, String value, boolean strict) {
        if (value == null || value.isBlank()) {
            String message = "필수 설정이 비어 있습니다: " + name;
            if (strict) {
                throw new IllegalStateException(message);
            }
            log.warn(message);
        }
    }
}
