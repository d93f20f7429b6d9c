/**
 * Circuit Breaker 상태 머신 패키지.
 *
 * <p>{@link com.ryuqq.resilience.core.statemachine.CircuitTransition}은
 * {@link com.ryuqq.resilience.core.protection.CircuitBreakerState} 사이의 전이 규칙을 검증합니다.
 * Circuit Breaker 구현체는 상태를 바꿀 때마다 이 클래스를 거쳐야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.statemachine;
