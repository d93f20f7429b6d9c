package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.model.GlobalSettings;
import com.ryuqq.resilience.core.model.DegradationLevel;

/**
 * Orchestrator 전역 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxConcurrentOperations: 동시 실행 한도 기준값 (기본 100)</li>
 *   <li>enableHealthChecks: 주기적 헬스 체크 (기본 true)</li>
 *   <li>enableCircuitBreakers: Circuit Breaker (기본 true)</li>
 *   <li>enableRetries: 재시도 (기본 true)</li>
 *   <li>enableFallbacks: Fallback 체인 (기본 true)</li>
 *   <li>enableMetrics: 메트릭 및 시스템 이벤트 기록 (기본 true)</li>
 *   <li>defaultLanguage: 사용자 메시지 기본 언어 (기본 "fr")</li>
 *   <li>healthCheckIntervalMs: 헬스 체크 주기 (기본 30000ms)</li>
 *   <li>shutdownTimeoutMs: 종료 시 실행 중 호출 대기 한도 (기본 30000ms)</li>
 *   <li>emergencyMaxConcurrentOperations: SEVERE 단계 동시 실행 한도 (기본 10)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxConcurrentOperations 동시 실행 한도 기준값 (양수)
 * @param enableHealthChecks 주기적 헬스 체크 활성 여부
 * @param enableCircuitBreakers Circuit Breaker 활성 여부
 * @param enableRetries 재시도 활성 여부
 * @param enableFallbacks Fallback 체인 활성 여부
 * @param enableMetrics 메트릭 기록 활성 여부
 * @param defaultLanguage 기본 언어 태그
 * @param healthCheckIntervalMs 헬스 체크 주기 (밀리초, 양수)
 * @param shutdownTimeoutMs 종료 대기 한도 (밀리초, 0 이상)
 * @param emergencyMaxConcurrentOperations SEVERE 단계 동시 실행 한도 (양수)
 */
public record OrchestratorConfig(
    int maxConcurrentOperations,
    boolean enableHealthChecks,
    boolean enableCircuitBreakers,
    boolean enableRetries,
    boolean enableFallbacks,
    boolean enableMetrics,
    String defaultLanguage,
    long healthCheckIntervalMs,
    long shutdownTimeoutMs,
    int emergencyMaxConcurrentOperations
) {

    /**
     * 기본 설정 생성자.
     */
    public OrchestratorConfig() {
        this(100, true, true, true, true, true, "fr", 30000, 30000, 10);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public OrchestratorConfig {
        if (maxConcurrentOperations <= 0) {
            throw new IllegalArgumentException(
                "maxConcurrentOperations must be positive (current: " + maxConcurrentOperations + ")"
            );
        }
        if (defaultLanguage == null || defaultLanguage.isBlank()) {
            throw new IllegalArgumentException("defaultLanguage cannot be null or blank");
        }
        if (healthCheckIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "healthCheckIntervalMs must be positive (current: " + healthCheckIntervalMs + ")"
            );
        }
        if (shutdownTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be non-negative (current: " + shutdownTimeoutMs + ")"
            );
        }
        if (emergencyMaxConcurrentOperations <= 0) {
            throw new IllegalArgumentException(
                "emergencyMaxConcurrentOperations must be positive (current: " + emergencyMaxConcurrentOperations + ")"
            );
        }
    }

    /**
     * 성능 저하가 없는 기준 전역 설정.
     *
     * @return NORMAL 단계 전역 설정
     */
    public GlobalSettings baselineSettings() {
        return new GlobalSettings(
            DegradationLevel.NORMAL,
            maxConcurrentOperations,
            DegradationLevel.NORMAL.timeoutMultiplier(),
            enableCircuitBreakers,
            enableHealthChecks,
            enableRetries,
            enableFallbacks
        );
    }

    public OrchestratorConfig withMaxConcurrentOperations(int maxConcurrentOperations) {
        return new OrchestratorConfig(maxConcurrentOperations, enableHealthChecks, enableCircuitBreakers,
            enableRetries, enableFallbacks, enableMetrics, defaultLanguage, healthCheckIntervalMs,
            shutdownTimeoutMs, emergencyMaxConcurrentOperations);
    }

    public OrchestratorConfig withHealthChecks(boolean enableHealthChecks) {
        return new OrchestratorConfig(maxConcurrentOperations, enableHealthChecks, enableCircuitBreakers,
            enableRetries, enableFallbacks, enableMetrics, defaultLanguage, healthCheckIntervalMs,
            shutdownTimeoutMs, emergencyMaxConcurrentOperations);
    }

    public OrchestratorConfig withCircuitBreakers(boolean enableCircuitBreakers) {
        return new OrchestratorConfig(maxConcurrentOperations, enableHealthChecks, enableCircuitBreakers,
            enableRetries, enableFallbacks, enableMetrics, defaultLanguage, healthCheckIntervalMs,
            shutdownTimeoutMs, emergencyMaxConcurrentOperations);
    }

    public OrchestratorConfig withRetries(boolean enableRetries) {
        return new OrchestratorConfig(maxConcurrentOperations, enableHealthChecks, enableCircuitBreakers,
            enableRetries, enableFallbacks, enableMetrics, defaultLanguage, healthCheckIntervalMs,
            shutdownTimeoutMs, emergencyMaxConcurrentOperations);
    }

    public OrchestratorConfig withFallbacks(boolean enableFallbacks) {
        return new OrchestratorConfig(maxConcurrentOperations, enableHealthChecks, enableCircuitBreakers,
            enableRetries, enableFallbacks, enableMetrics, defaultLanguage, healthCheckIntervalMs,
            shutdownTimeoutMs, emergencyMaxConcurrentOperations);
    }

    public OrchestratorConfig withMetrics(boolean enableMetrics) {
        return new OrchestratorConfig(maxConcurrentOperations, enableHealthChecks, enableCircuitBreakers,
            enableRetries, enableFallbacks, enableMetrics, defaultLanguage, healthCheckIntervalMs,
            shutdownTimeoutMs, emergencyMaxConcurrentOperations);
    }

    public OrchestratorConfig withDefaultLanguage(String defaultLanguage) {
        return new OrchestratorConfig(maxConcurrentOperations, enableHealthChecks, enableCircuitBreakers,
            enableRetries, enableFallbacks, enableMetrics, defaultLanguage, healthCheckIntervalMs,
            shutdownTimeoutMs, emergencyMaxConcurrentOperations);
    }

    public OrchestratorConfig withHealthCheckIntervalMs(long healthCheckIntervalMs) {
        return new OrchestratorConfig(maxConcurrentOperations, enableHealthChecks, enableCircuitBreakers,
            enableRetries, enableFallbacks, enableMetrics, defaultLanguage, healthCheckIntervalMs,
            shutdownTimeoutMs, emergencyMaxConcurrentOperations);
    }

    public OrchestratorConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new OrchestratorConfig(maxConcurrentOperations, enableHealthChecks, enableCircuitBreakers,
            enableRetries, enableFallbacks, enableMetrics, defaultLanguage, healthCheckIntervalMs,
            shutdownTimeoutMs, emergencyMaxConcurrentOperations);
    }

    public OrchestratorConfig withEmergencyMaxConcurrentOperations(int emergencyMaxConcurrentOperations) {
        return new OrchestratorConfig(maxConcurrentOperations, enableHealthChecks, enableCircuitBreakers,
            enableRetries, enableFallbacks, enableMetrics, defaultLanguage, healthCheckIntervalMs,
            shutdownTimeoutMs, emergencyMaxConcurrentOperations);
    }
}
