package com.ryuqq.resilience.core.model;

/**
 * 외부 의존성별 복원력 설정 (불변 record).
 *
 * <p>등록 시점의 인스턴스가 기준선(baseline)이 되며, 시스템 성능 저하(degradation) 처리 시에는
 * {@link #withTimeoutMs(long)}로 만든 작업용 사본만 교체됩니다. 복구 시 기준선 인스턴스가 그대로 복원됩니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>timeoutMs: 시도당 타임아웃 (기본 30000ms, 0은 타임아웃 없음)</li>
 *   <li>maxRetries: 최대 재시도 횟수 (기본 3, 총 시도 = maxRetries + 1)</li>
 *   <li>circuitBreakerThreshold: OPEN 전이 연속 실패 수 (기본 5)</li>
 *   <li>circuitBreakerResetTimeoutMs: OPEN 유지 시간 (기본 60000ms)</li>
 *   <li>healthCheckIntervalMs: 헬스 체크 주기 (기본 60000ms)</li>
 *   <li>baseDelayMs / maxDelayMs / backoffMultiplier: 재시도 백오프 (기본 1000ms / 30000ms / 2.0)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param name 의존성 이름 (영숫자, 하이픈, 언더스코어)
 * @param timeoutMs 시도당 타임아웃 (밀리초, 0 이상)
 * @param maxRetries 최대 재시도 횟수 (0 이상)
 * @param circuitBreakerThreshold Circuit Breaker 실패 임계값 (1 이상)
 * @param circuitBreakerResetTimeoutMs Circuit Breaker 리셋 대기 시간 (밀리초, 양수)
 * @param healthCheckIntervalMs 헬스 체크 주기 (밀리초, 양수)
 * @param baseDelayMs 백오프 기본 지연 (밀리초, 양수)
 * @param maxDelayMs 백오프 최대 지연 (밀리초, baseDelayMs 이상)
 * @param backoffMultiplier 백오프 배수 (1.0 이상)
 */
public record DependencyConfig(
    String name,
    long timeoutMs,
    int maxRetries,
    int circuitBreakerThreshold,
    long circuitBreakerResetTimeoutMs,
    long healthCheckIntervalMs,
    long baseDelayMs,
    long maxDelayMs,
    double backoffMultiplier
) {

    public static final long DEFAULT_TIMEOUT_MS = 30000;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int DEFAULT_CIRCUIT_BREAKER_THRESHOLD = 5;
    public static final long DEFAULT_RESET_TIMEOUT_MS = 60000;
    public static final long DEFAULT_HEALTH_CHECK_INTERVAL_MS = 60000;
    public static final long DEFAULT_BASE_DELAY_MS = 1000;
    public static final long DEFAULT_MAX_DELAY_MS = 30000;
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public DependencyConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (!name.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException(
                "name contains invalid characters (current: " + name + ")"
            );
        }
        if (timeoutMs < 0) {
            throw new IllegalArgumentException(
                "timeoutMs must be non-negative (current: " + timeoutMs + ")"
            );
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException(
                "maxRetries must be non-negative (current: " + maxRetries + ")"
            );
        }
        if (circuitBreakerThreshold < 1) {
            throw new IllegalArgumentException(
                "circuitBreakerThreshold must be >= 1 (current: " + circuitBreakerThreshold + ")"
            );
        }
        if (circuitBreakerResetTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "circuitBreakerResetTimeoutMs must be positive (current: " + circuitBreakerResetTimeoutMs + ")"
            );
        }
        if (healthCheckIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "healthCheckIntervalMs must be positive (current: " + healthCheckIntervalMs + ")"
            );
        }
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException(
                "backoffMultiplier must be >= 1.0 (current: " + backoffMultiplier + ")"
            );
        }
    }

    /**
     * 이름만 지정하고 나머지는 기본값으로 생성.
     *
     * @param name 의존성 이름
     * @return 기본 설정
     */
    public static DependencyConfig defaults(String name) {
        return new DependencyConfig(
            name,
            DEFAULT_TIMEOUT_MS,
            DEFAULT_MAX_RETRIES,
            DEFAULT_CIRCUIT_BREAKER_THRESHOLD,
            DEFAULT_RESET_TIMEOUT_MS,
            DEFAULT_HEALTH_CHECK_INTERVAL_MS,
            DEFAULT_BASE_DELAY_MS,
            DEFAULT_MAX_DELAY_MS,
            DEFAULT_BACKOFF_MULTIPLIER
        );
    }

    /**
     * 주요 항목을 지정하여 생성 (리셋 시간 및 백오프는 기본값).
     */
    public static DependencyConfig of(String name, long timeoutMs, int maxRetries,
                                      int circuitBreakerThreshold, long healthCheckIntervalMs) {
        return defaults(name)
            .withTimeoutMs(timeoutMs)
            .withMaxRetries(maxRetries)
            .withCircuitBreakerThreshold(circuitBreakerThreshold)
            .withHealthCheckIntervalMs(healthCheckIntervalMs);
    }

    public DependencyConfig withTimeoutMs(long timeoutMs) {
        return new DependencyConfig(name, timeoutMs, maxRetries, circuitBreakerThreshold,
            circuitBreakerResetTimeoutMs, healthCheckIntervalMs, baseDelayMs, maxDelayMs, backoffMultiplier);
    }

    public DependencyConfig withMaxRetries(int maxRetries) {
        return new DependencyConfig(name, timeoutMs, maxRetries, circuitBreakerThreshold,
            circuitBreakerResetTimeoutMs, healthCheckIntervalMs, baseDelayMs, maxDelayMs, backoffMultiplier);
    }

    public DependencyConfig withCircuitBreakerThreshold(int circuitBreakerThreshold) {
        return new DependencyConfig(name, timeoutMs, maxRetries, circuitBreakerThreshold,
            circuitBreakerResetTimeoutMs, healthCheckIntervalMs, baseDelayMs, maxDelayMs, backoffMultiplier);
    }

    public DependencyConfig withCircuitBreakerResetTimeoutMs(long circuitBreakerResetTimeoutMs) {
        return new DependencyConfig(name, timeoutMs, maxRetries, circuitBreakerThreshold,
            circuitBreakerResetTimeoutMs, healthCheckIntervalMs, baseDelayMs, maxDelayMs, backoffMultiplier);
    }

    public DependencyConfig withHealthCheckIntervalMs(long healthCheckIntervalMs) {
        return new DependencyConfig(name, timeoutMs, maxRetries, circuitBreakerThreshold,
            circuitBreakerResetTimeoutMs, healthCheckIntervalMs, baseDelayMs, maxDelayMs, backoffMultiplier);
    }

    /**
     * 백오프 설정만 변경한 새 인스턴스 생성.
     */
    public DependencyConfig withBackoff(long baseDelayMs, long maxDelayMs, double backoffMultiplier) {
        return new DependencyConfig(name, timeoutMs, maxRetries, circuitBreakerThreshold,
            circuitBreakerResetTimeoutMs, healthCheckIntervalMs, baseDelayMs, maxDelayMs, backoffMultiplier);
    }

    /**
     * 타임아웃에 배수를 적용한 사본 생성 (소수점 이하 버림).
     *
     * <p>양수 타임아웃은 최소 1ms로 유지됩니다 (0은 타임아웃 없음을 의미). 0이면 그대로 0입니다.</p>
     *
     * @param multiplier 배수 (0 초과 1 이하)
     * @return 타임아웃이 조정된 사본
     */
    public DependencyConfig scaleTimeout(double multiplier) {
        if (multiplier <= 0.0 || multiplier > 1.0) {
            throw new IllegalArgumentException(
                "multiplier must be in (0.0, 1.0] (current: " + multiplier + ")"
            );
        }
        if (timeoutMs == 0) {
            return this;
        }
        return withTimeoutMs(Math.max(1L, (long) Math.floor(timeoutMs * multiplier)));
    }
}
