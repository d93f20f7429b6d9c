package com.ryuqq.resilience.core.model;

import java.time.Instant;

/**
 * 의존성 헬스 상태 스냅샷.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param name 의존성 이름
 * @param state 현재 상태
 * @param lastCheck 마지막 프로브 시각 (프로브 전에는 null)
 * @param consecutiveFailures 연속 실패 횟수
 * @param maxFailures UNHEALTHY 판정 기준
 * @param lastDetail 마지막 프로브 응답 또는 오류 메시지 (null 허용)
 */
public record HealthStatus(
    String name,
    HealthState state,
    Instant lastCheck,
    int consecutiveFailures,
    int maxFailures,
    String lastDetail
) {

    public HealthStatus {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (consecutiveFailures < 0) {
            throw new IllegalArgumentException(
                "consecutiveFailures must be non-negative (current: " + consecutiveFailures + ")"
            );
        }
        if (maxFailures < 1) {
            throw new IllegalArgumentException(
                "maxFailures must be positive (current: " + maxFailures + ")"
            );
        }
    }

    /**
     * 등록 직후의 초기 상태.
     */
    public static HealthStatus unknown(String name, int maxFailures) {
        return new HealthStatus(name, HealthState.UNKNOWN, null, 0, maxFailures, null);
    }

    public boolean isHealthy() {
        return state == HealthState.HEALTHY;
    }
}
