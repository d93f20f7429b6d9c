/**
 * 작업 결과 타입 패키지.
 *
 * <p>최상위 실행 경계에서 예외를 던지는 대신 {@link com.ryuqq.resilience.core.outcome.Outcome}
 * 값으로 결과를 돌려줄 때 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.outcome;
