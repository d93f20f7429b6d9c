package com.ryuqq.resilience.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p>Circuit Breaker는 외부 의존성 호출의 연속 실패를 추적하고,
 * 임계값에 도달하면 요청을 차단하여 장애 전파를 방지합니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 수 = 임계값)
 * OPEN (차단)
 *   │
 *   ▼ (마지막 실패 후 resetTimeout 경과)
 * HALF_OPEN (반개방)
 *   │
 *   ├─► 연속 3회 성공 → CLOSED
 *   └─► 1회 실패 → OPEN
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     *
     * <p>성공 시 실패 카운터가 0으로 초기화되고, 실패 카운터가 임계값에 도달하면 OPEN으로 전이합니다.</p>
     */
    CLOSED,

    /**
     * 차단 상태 (요청 즉시 거부).
     *
     * <p>작업을 실행하지 않고 즉시 실패하거나 Fallback을 실행합니다.
     * resetTimeout이 경과하면 다음 호출에서 HALF_OPEN으로 전이합니다.</p>
     */
    OPEN,

    /**
     * 반개방 상태 (시험 요청 통과).
     *
     * <p>요청을 통과시켜 의존성의 복구 여부를 시험합니다.
     * 연속 성공 횟수가 시험 횟수에 도달하면 CLOSED, 한 번이라도 실패하면 다시 OPEN으로 전이합니다.</p>
     */
    HALF_OPEN
}
