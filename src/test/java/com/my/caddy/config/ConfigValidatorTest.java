package com.my.caddy.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigValidatorTest {

    @Test
    void defaults_have_no_problems() {
        assertThat(ConfigValidator.problems(new TestAppConfig())).isEmpty();
    }

    @Test
    void confirm_threshold_must_stay_below_route_threshold() {
        TestAppConfig config = new TestAppConfig();
        config.confirmThreshold = 0.80;

        assertThat(ConfigValidator.problems(config))
                .singleElement()
                .asString()
                .contains("confirm=0.8");
    }

    @Test
    void offline_thresholds_are_checked_independently() {
        TestAppConfig config = new TestAppConfig();
        config.weakThreshold = 0.70;
        config.routeThreshold = 1.5;

        assertThat(ConfigValidator.problems(config)).hasSize(2);
    }

    @Test
    void rejects_unknown_zone_and_non_positive_values() {
        TestAppConfig config = new TestAppConfig();
        config.zone = "Mars/Olympus";
        config.historyCapacity = 0;
        config.voiceTimeoutMs = 0;
        config.ttlHours = 0;

        assertThat(ConfigValidator.problems(config)).hasSize(4);
    }

    @Test
    void memory_settings_are_validated() {
        TestAppConfig config = new TestAppConfig();
        config.minShare = 1.2;

        assertThat(ConfigValidator.problems(config)).hasSize(1);
    }
}
