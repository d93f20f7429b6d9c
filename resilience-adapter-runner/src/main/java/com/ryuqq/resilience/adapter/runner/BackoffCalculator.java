package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.model.DependencyConfig;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>재시도 간격을 지수적으로 증가시키되, Jitter를 곱하여
 * 여러 호출자가 동시에 재시도하는 현상(Thundering Herd)을 방지합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * base  = min(maxDelay, baseDelay * multiplier^retryIndex)
 * delay = floor(base * U[0.5, 1.0])
 * </pre>
 *
 * <p><strong>예시 (baseDelay=1000ms, multiplier=2, maxDelay=30000ms):</strong></p>
 * <ul>
 *   <li>retryIndex=0: 1000ms → 500-1000ms</li>
 *   <li>retryIndex=1: 2000ms → 1000-2000ms</li>
 *   <li>retryIndex=2: 4000ms → 2000-4000ms</li>
 *   <li>retryIndex=5: 32000ms (capped at 30000ms) → 15000-30000ms</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private static final double MIN_JITTER = 0.5;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double multiplier;
    private final DoubleSupplier random;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: baseDelay=1000ms, maxDelay=30000ms, multiplier=2.0</p>
     */
    public BackoffCalculator() {
        this(DependencyConfig.DEFAULT_BASE_DELAY_MS, DependencyConfig.DEFAULT_MAX_DELAY_MS,
            DependencyConfig.DEFAULT_BACKOFF_MULTIPLIER);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수여야 함)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param multiplier 증가 배수 (1.0 이상)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double multiplier) {
        this(baseDelayMs, maxDelayMs, multiplier, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 난수 공급자를 지정하여 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수여야 함)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param multiplier 증가 배수 (1.0 이상)
     * @param random [0.0, 1.0) 범위의 난수 공급자
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double multiplier, DoubleSupplier random) {
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
        if (multiplier < 1.0) {
            throw new IllegalArgumentException(
                "multiplier must be >= 1.0 (current: " + multiplier + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }

        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.multiplier = multiplier;
        this.random = random;
    }

    /**
     * 의존성 설정의 백오프 값으로 생성.
     *
     * @param config 의존성 설정
     * @return BackoffCalculator
     */
    public static BackoffCalculator from(DependencyConfig config) {
        return new BackoffCalculator(config.baseDelayMs(), config.maxDelayMs(), config.backoffMultiplier());
    }

    /**
     * Jitter 적용 전 지연 시간.
     *
     * @param retryIndex 실패한 시도의 인덱스 (0부터 시작)
     * @return 지연 시간 (밀리초, maxDelay 이하)
     * @throws IllegalArgumentException retryIndex가 음수인 경우
     */
    public long baseDelay(int retryIndex) {
        if (retryIndex < 0) {
            throw new IllegalArgumentException(
                "retryIndex must be non-negative (current: " + retryIndex + ")"
            );
        }

        // double로 계산하여 overflow 방지
        double exponential = baseDelayMs * Math.pow(multiplier, retryIndex);
        return (long) Math.min(maxDelayMs, exponential);
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * <p>시도 i (0부터)가 실패한 뒤 시도 i+1 전에 대기할 시간입니다.
     * 첫 시도 전에는 대기하지 않습니다.</p>
     *
     * @param retryIndex 실패한 시도의 인덱스 (0부터 시작)
     * @return 재시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException retryIndex가 음수인 경우
     */
    public long calculate(int retryIndex) {
        long delay = baseDelay(retryIndex);
        double jitter = MIN_JITTER + random.getAsDouble() * (1.0 - MIN_JITTER);
        return (long) Math.floor(delay * jitter);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getMultiplier() {
        return multiplier;
    }
}
