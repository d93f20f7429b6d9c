package com.ryuqq.resilience.core.statemachine;

import com.ryuqq.resilience.core.protection.CircuitBreakerState;

/**
 * Circuit Breaker 상태 전이 검증 및 실행.
 *
 * <p>이 클래스는 Circuit Breaker의 상태 전이가 허용된 규칙을 따르는지
 * 검증하고, 불변식을 보장합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>CLOSED → OPEN (연속 실패 임계값 도달)</li>
 *   <li>OPEN → HALF_OPEN (resetTimeout 경과)</li>
 *   <li>HALF_OPEN → CLOSED (시험 호출 연속 성공)</li>
 *   <li>HALF_OPEN → OPEN (시험 호출 실패)</li>
 *   <li>모든 상태 → CLOSED (수동 리셋, {@link #reset(CircuitBreakerState)})</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>OPEN → CLOSED 직접 전이 불가 (리셋 제외)</li>
 *   <li>CLOSED → HALF_OPEN 전이 불가</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CircuitTransition {

    // Utility class - prevent instantiation
    private CircuitTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(CircuitBreakerState from, CircuitBreakerState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        boolean valid = switch (from) {
            case CLOSED -> to == CircuitBreakerState.OPEN;
            case OPEN -> to == CircuitBreakerState.HALF_OPEN;
            case HALF_OPEN -> to == CircuitBreakerState.CLOSED || to == CircuitBreakerState.OPEN;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid circuit transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static CircuitBreakerState transition(CircuitBreakerState current, CircuitBreakerState next) {
        validate(current, next);
        return next;
    }

    /**
     * 수동 리셋.
     *
     * <p>어떤 상태에서든 CLOSED로 돌아갑니다.</p>
     *
     * @param current 현재 상태
     * @return CLOSED
     */
    public static CircuitBreakerState reset(CircuitBreakerState current) {
        if (current == null) {
            throw new IllegalArgumentException("current cannot be null");
        }
        return CircuitBreakerState.CLOSED;
    }
}
