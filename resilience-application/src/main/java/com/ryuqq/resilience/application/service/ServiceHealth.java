package com.ryuqq.resilience.application.service;

import com.ryuqq.resilience.core.model.DependencyConfig;
import com.ryuqq.resilience.core.protection.CircuitSnapshot;

import java.time.Instant;

/**
 * 의존성 하나의 보호 계층 상태.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param service 의존성 이름
 * @param circuitBreaker Circuit Breaker 스냅샷
 * @param workingConfig 현재 적용 중인 설정
 * @param timestamp 조회 시각
 */
public record ServiceHealth(
    String service,
    CircuitSnapshot circuitBreaker,
    DependencyConfig workingConfig,
    Instant timestamp
) {

    public ServiceHealth {
        if (service == null || service.isBlank()) {
            throw new IllegalArgumentException("service cannot be null or blank");
        }
        if (circuitBreaker == null) {
            throw new IllegalArgumentException("circuitBreaker cannot be null");
        }
    }
}
