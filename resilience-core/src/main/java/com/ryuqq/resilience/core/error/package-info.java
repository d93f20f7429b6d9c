/**
 * 오류 분류 패키지.
 *
 * <p>오류는 만들어지는 지점에서 {@link com.ryuqq.resilience.core.error.ErrorKind} 태그를 가지며,
 * 재시도 가능 여부는 태그에 매핑된 데이터로 판정합니다.</p>
 *
 * <h2>전파 규칙</h2>
 * <pre>
 * 작업 실패
 *   → Retry/Deadline (ResilientService 내부에서 모두 소진)
 *   → Circuit Breaker (소진된 실패만 집계)
 *   → Fallback 체인 (모두 실패 시 원래 오류 유지)
 *   → OperationFailedException (의존성, Circuit 스냅샷, 사용자 문구 포함)
 * </pre>
 *
 * <p>{@link com.ryuqq.resilience.core.error.CapacityExceededException}은 의존성 경로에 진입하기 전에
 * 발생하므로 재시도나 Circuit Breaker 집계 대상이 아닙니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.error;
