package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.model.DegradationLevel;
import com.ryuqq.resilience.core.model.GlobalSettings;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * OrchestratorConfig 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class OrchestratorConfigTest {

    @Test
    void 기본값() {
        OrchestratorConfig config = new OrchestratorConfig();

        assertThat(config.maxConcurrentOperations()).isEqualTo(100);
        assertThat(config.enableHealthChecks()).isTrue();
        assertThat(config.enableCircuitBreakers()).isTrue();
        assertThat(config.enableRetries()).isTrue();
        assertThat(config.enableFallbacks()).isTrue();
        assertThat(config.enableMetrics()).isTrue();
        assertThat(config.defaultLanguage()).isEqualTo("fr");
        assertThat(config.healthCheckIntervalMs()).isEqualTo(30000);
        assertThat(config.shutdownTimeoutMs()).isEqualTo(30000);
        assertThat(config.emergencyMaxConcurrentOperations()).isEqualTo(10);
    }

    @Test
    void baselineSettings_설정의_스위치를_그대로_반영() {
        OrchestratorConfig config = new OrchestratorConfig()
            .withMaxConcurrentOperations(40)
            .withRetries(false)
            .withFallbacks(false);

        GlobalSettings settings = config.baselineSettings();

        assertThat(settings.level()).isEqualTo(DegradationLevel.NORMAL);
        assertThat(settings.maxConcurrentOperations()).isEqualTo(40);
        assertThat(settings.timeoutMultiplier()).isEqualTo(1.0);
        assertThat(settings.retriesEnabled()).isFalse();
        assertThat(settings.fallbacksEnabled()).isFalse();
        assertThat(settings.circuitBreakersEnabled()).isTrue();
    }

    @Test
    void with_메서드는_해당_값만_변경한_사본_반환() {
        OrchestratorConfig original = new OrchestratorConfig();

        OrchestratorConfig changed = original
            .withDefaultLanguage("mg")
            .withHealthCheckIntervalMs(5000)
            .withEmergencyMaxConcurrentOperations(3)
            .withCircuitBreakers(false);

        assertThat(changed.defaultLanguage()).isEqualTo("mg");
        assertThat(changed.healthCheckIntervalMs()).isEqualTo(5000);
        assertThat(changed.emergencyMaxConcurrentOperations()).isEqualTo(3);
        assertThat(changed.enableCircuitBreakers()).isFalse();
        assertThat(changed.maxConcurrentOperations()).isEqualTo(100);
        assertThat(original.defaultLanguage()).isEqualTo("fr");
    }

    @Test
    void 잘못된_값은_거부() {
        OrchestratorConfig config = new OrchestratorConfig();

        assertThatThrownBy(() -> config.withMaxConcurrentOperations(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxConcurrentOperations");
        assertThatThrownBy(() -> config.withDefaultLanguage(" "))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.withHealthCheckIntervalMs(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.withShutdownTimeoutMs(-1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.withEmergencyMaxConcurrentOperations(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
