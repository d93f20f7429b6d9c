/**
 * Protection SPI (Service Provider Interface) 패키지.
 *
 * <p>외부 의존성 호출 시 발생할 수 있는 장애를 격리하기 위한 확장점을 정의합니다:
 * {@link com.ryuqq.resilience.core.protection.CircuitBreaker},
 * {@link com.ryuqq.resilience.core.protection.FallbackStrategy},
 * {@link com.ryuqq.resilience.core.protection.HealthProbe}.</p>
 *
 * <h2>Protection 체인 순서</h2>
 *
 * <p>ResilientService는 다음 순서로 보호 계층을 구성합니다 (바깥쪽부터):</p>
 * <pre>
 * 1. Fallback 체인   → 아래 계층이 모두 실패한 뒤 대체 전략 실행
 * 2. CircuitBreaker  → OPEN 상태 시 즉시 실패
 * 3. Retry           → 재시도 가능한 오류에 한해 백오프 후 재시도
 * 4. Deadline        → 시도당 타임아웃
 * 5. Operation       → 실제 외부 호출
 * </pre>
 *
 * <h3>체인 순서 선정 이유</h3>
 * <ul>
 *   <li><strong>Circuit Breaker가 Retry 바깥:</strong> 재시도 예산 안에서 결국 성공한 호출은 실패로 집계되지 않음</li>
 *   <li><strong>Deadline이 가장 안쪽:</strong> 타임아웃은 시도 단위로 적용되고, 타임아웃 자체도 재시도 대상</li>
 *   <li><strong>Fallback이 가장 바깥:</strong> Circuit OPEN으로 차단된 호출도 Fallback으로 응답 가능</li>
 * </ul>
 *
 * <h2>NoOp 구현</h2>
 *
 * <p>{@code noop} 하위 패키지의 구현은 모든 요청을 허용하고 상태를 추적하지 않습니다.
 * Circuit Breaker가 전역 비활성화된 동안 사용됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @see com.ryuqq.resilience.core.protection.noop
 */
package com.ryuqq.resilience.core.protection;
