package com.ryuqq.resilience.application.service;

import com.ryuqq.resilience.core.error.OperationFailedException;
import com.ryuqq.resilience.core.model.DependencyConfig;
import com.ryuqq.resilience.core.model.OperationId;
import com.ryuqq.resilience.core.model.OperationOptions;
import com.ryuqq.resilience.core.model.OperationResult;

import java.util.concurrent.Callable;

/**
 * 단일 외부 의존성에 대한 보호 계층 Façade.
 *
 * <p>의존성 하나에 대해 Deadline, Retry, Circuit Breaker, Fallback 체인을 하나의 호출로 묶습니다.
 * 호출자는 보호 계층을 직접 조립하지 않고 작업만 전달합니다.</p>
 *
 * <p><strong>실행 순서 (바깥쪽부터):</strong></p>
 * <pre>
 * Fallback 체인
 *   └─ Circuit Breaker
 *        └─ Retry (retryable 옵션이 true일 때)
 *             └─ Deadline (시도당 타임아웃)
 *                  └─ operation
 * </pre>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ResilientService translation = orchestrator.getService("translation").orElseThrow();
 *
 * OperationResult<String> result = translation.execute(
 *     () -> translator.translate(text, "mg"),
 *     OperationOptions.defaults().withOperationName("translateClause")
 * );
 *
 * if (result.fallbackUsed()) {
 *     log.warn("translation answered by fallback: {}", result.originalError());
 * }
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ResilientService {

    /**
     * 보호된 의존성 이름.
     *
     * @return 의존성 이름
     */
    String getName();

    /**
     * 보호 계층을 거쳐 작업 실행.
     *
     * @param operation 실행할 작업
     * @param options 호출 옵션
     * @param <T> 결과 타입
     * @return 주 경로 또는 Fallback 결과
     * @throws OperationFailedException 주 경로와 모든 Fallback이 실패한 경우
     */
    <T> OperationResult<T> execute(Callable<T> operation, OperationOptions options);

    /**
     * 호출 식별자를 지정하여 작업 실행.
     *
     * <p>Orchestrator가 발급한 식별자를 결과와 오류에 그대로 싣기 위해 사용됩니다.</p>
     *
     * @param operationId 호출 식별자 (null이면 Façade가 생성)
     * @param operation 실행할 작업
     * @param options 호출 옵션
     * @param <T> 결과 타입
     * @return 주 경로 또는 Fallback 결과
     * @throws OperationFailedException 주 경로와 모든 Fallback이 실패한 경우
     */
    <T> OperationResult<T> execute(OperationId operationId, Callable<T> operation, OperationOptions options);

    /**
     * 의존성 상태 조회 (Circuit Breaker 스냅샷 + 현재 설정).
     *
     * @return 상태
     */
    ServiceHealth getHealthStatus();

    /**
     * Circuit Breaker 수동 리셋.
     */
    void resetCircuitBreaker();

    /**
     * 현재 적용 중인 설정 (성능 저하 시 타임아웃이 줄어든 값).
     *
     * @return 현재 설정
     */
    DependencyConfig getWorkingConfig();

    /**
     * 등록 시점의 기준 설정.
     *
     * @return 기준 설정
     */
    DependencyConfig getBaselineConfig();
}
