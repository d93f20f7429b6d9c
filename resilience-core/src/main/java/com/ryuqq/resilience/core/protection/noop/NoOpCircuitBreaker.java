package com.ryuqq.resilience.core.protection.noop;

import com.ryuqq.resilience.core.model.OperationId;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.protection.CircuitSnapshot;

/**
 * Circuit Breaker NoOp 구현.
 *
 * <p>모든 요청을 항상 허용하며, 상태 추적을 하지 않습니다.
 * Circuit Breaker가 전역 비활성화된 경우(SEVERE 성능 저하 등) 사용됩니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>tryAcquire(): 항상 true 반환</li>
 *   <li>recordSuccess(): 아무 동작 안 함</li>
 *   <li>recordFailure(): 아무 동작 안 함</li>
 *   <li>getState(): 항상 CLOSED 반환</li>
 *   <li>reset(): 아무 동작 안 함</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    private final String name;

    public NoOpCircuitBreaker() {
        this("noop");
    }

    public NoOpCircuitBreaker(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean tryAcquire(OperationId opId) {
        return true;
    }

    @Override
    public void recordSuccess(OperationId opId) {
        // NoOp
    }

    @Override
    public void recordFailure(OperationId opId, Throwable throwable) {
        // NoOp
    }

    @Override
    public CircuitBreakerState getState() {
        return CircuitBreakerState.CLOSED;
    }

    @Override
    public CircuitSnapshot snapshot() {
        return CircuitSnapshot.untracked();
    }

    @Override
    public void reset() {
        // NoOp
    }
}
