package com.ryuqq.resilience.core.error;

import com.ryuqq.resilience.core.protection.CircuitSnapshot;

/**
 * Circuit Breaker OPEN 상태로 호출이 차단됨.
 *
 * <p>차단된 호출은 작업을 전혀 실행하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CircuitOpenException extends ResilienceException {

    private final String circuitName;
    private final CircuitSnapshot snapshot;

    public CircuitOpenException(String circuitName, CircuitSnapshot snapshot) {
        super(ErrorKind.CIRCUIT_OPEN,
            "Circuit breaker is OPEN for " + circuitName + " - service temporarily unavailable");
        this.circuitName = circuitName;
        this.snapshot = snapshot;
    }

    public String getCircuitName() {
        return circuitName;
    }

    public CircuitSnapshot getSnapshot() {
        return snapshot;
    }
}
