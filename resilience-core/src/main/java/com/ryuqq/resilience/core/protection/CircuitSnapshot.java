package com.ryuqq.resilience.core.protection;

import java.time.Instant;

/**
 * Circuit Breaker 상태 스냅샷.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param state 현재 상태
 * @param failureCount 연속 실패 횟수
 * @param lastFailureTime 마지막 실패 시각 (실패 기록이 없으면 null)
 * @param halfOpenSuccessCount HALF_OPEN 상태에서의 연속 성공 횟수
 * @param failureThreshold OPEN 전이 임계값
 * @param resetTimeoutMs OPEN 유지 시간 (밀리초)
 */
public record CircuitSnapshot(
    CircuitBreakerState state,
    int failureCount,
    Instant lastFailureTime,
    int halfOpenSuccessCount,
    int failureThreshold,
    long resetTimeoutMs
) {

    public CircuitSnapshot {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
    }

    /**
     * 상태 추적을 하지 않는 Circuit Breaker의 스냅샷.
     */
    public static CircuitSnapshot untracked() {
        return new CircuitSnapshot(CircuitBreakerState.CLOSED, 0, null, 0, Integer.MAX_VALUE, 0);
    }

    public boolean isOpen() {
        return state == CircuitBreakerState.OPEN;
    }
}
