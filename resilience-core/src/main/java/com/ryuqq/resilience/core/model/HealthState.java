package com.ryuqq.resilience.core.model;

/**
 * 의존성 헬스 상태.
 *
 * <p><strong>판정 규칙:</strong></p>
 * <pre>
 * 등록 직후                                  → UNKNOWN
 * 프로브 성공 (consecutiveFailures = 0)        → HEALTHY
 * 0 &lt; consecutiveFailures &lt; maxFailures      → DEGRADED
 * consecutiveFailures &gt;= maxFailures          → UNHEALTHY
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum HealthState {

    UNKNOWN,

    HEALTHY,

    DEGRADED,

    UNHEALTHY;

    /**
     * 연속 실패 횟수로부터 상태 도출.
     *
     * @param consecutiveFailures 연속 실패 횟수 (0 이상)
     * @param maxFailures UNHEALTHY 판정 기준 (1 이상)
     * @return 도출된 상태
     */
    public static HealthState fromFailures(int consecutiveFailures, int maxFailures) {
        if (consecutiveFailures < 0) {
            throw new IllegalArgumentException(
                "consecutiveFailures must be non-negative (current: " + consecutiveFailures + ")"
            );
        }
        if (consecutiveFailures >= maxFailures) {
            return UNHEALTHY;
        }
        if (consecutiveFailures > 0) {
            return DEGRADED;
        }
        return HEALTHY;
    }
}
