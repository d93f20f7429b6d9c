package com.ryuqq.resilience.application.orchestrator;

/**
 * 시스템 전체 상태.
 *
 * <p>정상 의존성 비율(healthPercentage)로 결정됩니다.</p>
 * <ul>
 *   <li>80% 이상: HEALTHY</li>
 *   <li>50% 이상 80% 미만: DEGRADED</li>
 *   <li>50% 미만: CRITICAL</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum OverallStatus {

    HEALTHY,

    DEGRADED,

    CRITICAL;

    /**
     * 정상 의존성 비율로 전체 상태 결정.
     *
     * @param healthPercentage 0 ~ 100
     * @return 전체 상태
     */
    public static OverallStatus fromPercentage(int healthPercentage) {
        if (healthPercentage < 50) {
            return CRITICAL;
        }
        if (healthPercentage < 80) {
            return DEGRADED;
        }
        return HEALTHY;
    }

    /**
     * 정상 의존성 수로 비율 계산 (반올림). 의존성이 없으면 0.
     *
     * @param healthyCount 정상 의존성 수
     * @param totalCount 전체 의존성 수
     * @return 0 ~ 100
     */
    public static int percentage(int healthyCount, int totalCount) {
        if (totalCount <= 0) {
            return 0;
        }
        return (int) Math.round(100.0 * healthyCount / totalCount);
    }
}
