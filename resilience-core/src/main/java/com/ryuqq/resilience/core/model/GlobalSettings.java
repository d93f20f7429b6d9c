package com.ryuqq.resilience.core.model;

/**
 * 현재 적용 중인 전역 설정 스냅샷.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param level 현재 성능 저하 단계
 * @param maxConcurrentOperations 동시 작업 한도
 * @param timeoutMultiplier 의존성 타임아웃에 적용된 배수
 * @param circuitBreakersEnabled Circuit Breaker 활성 여부
 * @param healthChecksEnabled 주기적 헬스 체크 활성 여부
 * @param retriesEnabled 재시도 활성 여부
 * @param fallbacksEnabled Fallback 활성 여부
 */
public record GlobalSettings(
    DegradationLevel level,
    int maxConcurrentOperations,
    double timeoutMultiplier,
    boolean circuitBreakersEnabled,
    boolean healthChecksEnabled,
    boolean retriesEnabled,
    boolean fallbacksEnabled
) {

    public GlobalSettings {
        if (level == null) {
            throw new IllegalArgumentException("level cannot be null");
        }
        if (maxConcurrentOperations < 1) {
            throw new IllegalArgumentException(
                "maxConcurrentOperations must be positive (current: " + maxConcurrentOperations + ")"
            );
        }
    }

    /**
     * NORMAL 단계, 모든 보호 기능이 켜진 설정.
     *
     * @param maxConcurrentOperations 동시 작업 한도
     * @return 설정
     */
    public static GlobalSettings normal(int maxConcurrentOperations) {
        return new GlobalSettings(DegradationLevel.NORMAL, maxConcurrentOperations, 1.0, true, true, true, true);
    }
}
