package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.model.DependencyConfig;
import com.ryuqq.resilience.core.model.OperationId;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.protection.CircuitSnapshot;
import com.ryuqq.resilience.core.statemachine.CircuitTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 연속 실패 횟수 기반 Circuit Breaker.
 *
 * <p><strong>상태 규칙:</strong></p>
 * <ul>
 *   <li>CLOSED: 성공 시 실패 카운터 0, 실패 시 카운터 증가. 카운터가 임계값에 도달하면 OPEN</li>
 *   <li>OPEN: 마지막 실패 후 resetTimeout이 지나면 다음 tryAcquire에서 HALF_OPEN으로 전이하고 통과</li>
 *   <li>HALF_OPEN: 연속 {@value #HALF_OPEN_TRIAL_COUNT}회 성공 시 CLOSED, 1회 실패 시 OPEN</li>
 * </ul>
 *
 * <p>모든 상태 변경은 {@link CircuitTransition}을 거치며, 인스턴스 단위로 동기화됩니다.
 * HALF_OPEN 상태에서는 동시에 여러 시험 호출이 통과할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CountingCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CountingCircuitBreaker.class);

    /**
     * HALF_OPEN → CLOSED 전이에 필요한 연속 성공 횟수.
     */
    public static final int HALF_OPEN_TRIAL_COUNT = 3;

    private final String name;
    private final int failureThreshold;
    private final long resetTimeoutMs;
    private final Clock clock;

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int failureCount;
    private Instant lastFailureTime;
    private int halfOpenSuccessCount;

    public CountingCircuitBreaker(String name, int failureThreshold, long resetTimeoutMs) {
        this(name, failureThreshold, resetTimeoutMs, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param name Circuit 이름
     * @param failureThreshold OPEN 전이 임계값 (1 이상)
     * @param resetTimeoutMs OPEN 유지 시간 (밀리초, 양수)
     * @param clock 시간 소스
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CountingCircuitBreaker(String name, int failureThreshold, long resetTimeoutMs, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (failureThreshold < 1) {
            throw new IllegalArgumentException(
                "failureThreshold must be >= 1 (current: " + failureThreshold + ")"
            );
        }
        if (resetTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "resetTimeoutMs must be positive (current: " + resetTimeoutMs + ")"
            );
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.resetTimeoutMs = resetTimeoutMs;
        this.clock = clock;
    }

    /**
     * 의존성 설정으로 생성.
     *
     * @param config 의존성 설정
     * @param clock 시간 소스
     * @return CountingCircuitBreaker
     */
    public static CountingCircuitBreaker of(DependencyConfig config, Clock clock) {
        return new CountingCircuitBreaker(
            config.name(),
            config.circuitBreakerThreshold(),
            config.circuitBreakerResetTimeoutMs(),
            clock
        );
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public synchronized boolean tryAcquire(OperationId opId) {
        if (state != CircuitBreakerState.OPEN) {
            return true;
        }
        if (resetTimeoutElapsed()) {
            moveTo(CircuitBreakerState.HALF_OPEN);
            halfOpenSuccessCount = 0;
            return true;
        }
        log.debug("Circuit {} rejected {}", name, opId);
        return false;
    }

    @Override
    public synchronized void recordSuccess(OperationId opId) {
        switch (state) {
            case CLOSED -> failureCount = 0;
            case HALF_OPEN -> {
                failureCount = 0;
                halfOpenSuccessCount++;
                if (halfOpenSuccessCount >= HALF_OPEN_TRIAL_COUNT) {
                    moveTo(CircuitBreakerState.CLOSED);
                    halfOpenSuccessCount = 0;
                }
            }
            default -> {
                // OPEN 전이 전에 통과한 호출의 늦은 성공은 무시
            }
        }
    }

    @Override
    public synchronized void recordFailure(OperationId opId, Throwable throwable) {
        failureCount++;
        lastFailureTime = clock.instant();

        switch (state) {
            case CLOSED -> {
                if (failureCount >= failureThreshold) {
                    moveTo(CircuitBreakerState.OPEN);
                }
            }
            case HALF_OPEN -> {
                moveTo(CircuitBreakerState.OPEN);
                halfOpenSuccessCount = 0;
            }
            default -> {
                // 이미 OPEN: lastFailureTime만 갱신
            }
        }
    }

    @Override
    public synchronized CircuitBreakerState getState() {
        return state;
    }

    @Override
    public synchronized CircuitSnapshot snapshot() {
        return new CircuitSnapshot(state, failureCount, lastFailureTime, halfOpenSuccessCount,
            failureThreshold, resetTimeoutMs);
    }

    @Override
    public synchronized void reset() {
        state = CircuitTransition.reset(state);
        failureCount = 0;
        halfOpenSuccessCount = 0;
        lastFailureTime = null;
        log.info("Circuit breaker reset for {}", name);
    }

    private boolean resetTimeoutElapsed() {
        if (lastFailureTime == null) {
            return true;
        }
        return Duration.between(lastFailureTime, clock.instant()).toMillis() > resetTimeoutMs;
    }

    private void moveTo(CircuitBreakerState next) {
        CircuitBreakerState previous = state;
        state = CircuitTransition.transition(previous, next);
        if (next == CircuitBreakerState.OPEN) {
            log.warn("Circuit breaker {} opened ({} -> {}, failures: {})", name, previous, next, failureCount);
        } else {
            log.info("Circuit breaker {} transitioned {} -> {}", name, previous, next);
        }
    }
}
