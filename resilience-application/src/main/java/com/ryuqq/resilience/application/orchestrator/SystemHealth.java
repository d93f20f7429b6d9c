package com.ryuqq.resilience.application.orchestrator;

import com.ryuqq.resilience.application.service.ServiceHealth;
import com.ryuqq.resilience.core.model.HealthStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 시스템 전체 헬스 스냅샷.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param overall 전체 요약
 * @param services 의존성별 헬스 프로브 상태
 * @param circuitBreakers 의존성별 Circuit Breaker 상태
 * @param timestamp 조회 시각
 */
public record SystemHealth(
    Overall overall,
    Map<String, HealthStatus> services,
    Map<String, ServiceHealth> circuitBreakers,
    Instant timestamp
) {

    public SystemHealth {
        if (overall == null) {
            throw new IllegalArgumentException("overall cannot be null");
        }
        services = services == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(services));
        circuitBreakers = circuitBreakers == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(circuitBreakers));
    }

    /**
     * 전체 요약.
     *
     * @param status 전체 상태
     * @param healthPercentage 정상 의존성 비율 (0 ~ 100)
     * @param activeOperations 실행 중인 호출 수
     * @param maxConcurrentOperations 현재 동시 실행 한도
     */
    public record Overall(
        OverallStatus status,
        int healthPercentage,
        int activeOperations,
        int maxConcurrentOperations
    ) {

        public Overall {
            if (status == null) {
                throw new IllegalArgumentException("status cannot be null");
            }
            if (healthPercentage < 0 || healthPercentage > 100) {
                throw new IllegalArgumentException(
                    "healthPercentage must be between 0 and 100 (current: " + healthPercentage + ")"
                );
            }
        }
    }
}
