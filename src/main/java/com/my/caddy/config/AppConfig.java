package com.my.caddy.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

@StaticInitSafe
@ConfigMapping(prefix = "app")
public interface AppConfig {

    OpenAiConfig openai();

    ClassifierConfig classifier();

    OfflineConfig offline();

    MemoryConfig memory();

    SessionConfig session();

    ClockConfig clock();

    IdempotencyConfig idempotency();

    interface OpenAiConfig {
        @WithName("api-key")
        Optional<String> apiKey();

        @WithDefault("gpt-4o-mini")
        String model();

        @WithDefault("0.0")
        double temperature();
    }

    interface ClassifierConfig {
        @WithName("route-threshold")
        @WithDefault("0.75")
        double routeThreshold();

        @WithName("confirm-threshold")
        @WithDefault("0.50")
        double confirmThreshold();

        @WithName("text-timeout-ms")
        @WithDefault("3000")
        long textTimeoutMs();

        @WithName("voice-timeout-ms")
        @WithDefault("4500")
        long voiceTimeoutMs();
    }

    interface OfflineConfig {
        @WithName("strong-threshold")
        @WithDefault("0.70")
        double strongThreshold();

        @WithName("weak-threshold")
        @WithDefault("0.40")
        double weakThreshold();
    }

    interface MemoryConfig {
        @WithName("backend")
        @WithDefault("sqlite")
        String backend();

        @WithName("sqlite-path")
        @WithDefault("./data/caddy-memory.db")
        String sqlitePath();

        @WithName("half-life-days")
        @WithDefault("14")
        double halfLifeDays();

        @WithName("retention-days")
        @WithDefault("90")
        int retentionDays();

        @WithName("window-days")
        @WithDefault("30")
        int windowDays();

        @WithName("max-events")
        @WithDefault("50")
        int maxEvents();

        @WithName("min-samples")
        @WithDefault("3")
        int minSamples();

        @WithName("min-share")
        @WithDefault("0.30")
        double minShare();

        @WithName("maintenance-interval-minutes")
        @WithDefault("60")
        int maintenanceIntervalMinutes();
    }

    interface SessionConfig {
        @WithName("history-capacity")
        @WithDefault("10")
        int historyCapacity();
    }

    interface ClockConfig {
        @WithName("zone")
        @WithDefault("UTC")
        String zone();
    }

    interface IdempotencyConfig {
        @WithName("ttl-hours")
        @WithDefault("24")
        int ttlHours();
    }
}
