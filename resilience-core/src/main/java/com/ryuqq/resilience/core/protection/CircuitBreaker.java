package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.error.CircuitOpenException;
import com.ryuqq.resilience.core.model.OperationId;

import java.util.concurrent.Callable;

/**
 * Circuit Breaker SPI.
 *
 * <p>외부 의존성 호출의 연속 실패를 추적하고, 임계값에 도달하면 빠르게 실패(Fail-Fast)하여
 * 장애가 전체 시스템으로 전파되는 것을 방지합니다.</p>
 *
 * <p><strong>Circuit Breaker 패턴:</strong></p>
 * <ul>
 *   <li>CLOSED: 정상 동작, 연속 실패 추적</li>
 *   <li>OPEN: 요청 차단, 빠른 실패</li>
 *   <li>HALF_OPEN: 시험 요청으로 복구 확인</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = ...;
 *
 * // 직접 제어
 * if (!cb.tryAcquire(opId)) {
 *     throw new CircuitOpenException(cb.getName(), cb.snapshot());
 * }
 * try {
 *     Result result = externalApi.call();
 *     cb.recordSuccess(opId);
 *     return result;
 * } catch (Exception e) {
 *     cb.recordFailure(opId, e);
 *     throw e;
 * }
 *
 * // 또는 위임
 * Result result = cb.execute(opId, externalApi::call, null);
 * }</pre>
 *
 * <p>ResilientService에서 전달되는 작업은 이미 Retry와 Deadline으로 감싸져 있으므로,
 * Circuit Breaker는 재시도 예산을 모두 소진한 실패만 집계합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * Circuit Breaker 이름 (보통 의존성 이름).
     *
     * @return 이름
     */
    String getName();

    /**
     * Circuit Breaker 통과 허용 여부 확인.
     *
     * <ul>
     *   <li>CLOSED: 항상 true</li>
     *   <li>OPEN: resetTimeout 경과 시 HALF_OPEN으로 전이 후 true, 그 외 false</li>
     *   <li>HALF_OPEN: true (시험 요청)</li>
     * </ul>
     *
     * @param opId 호출 식별자 (로깅용, null 허용)
     * @return true: 요청 통과 허용, false: 요청 차단
     */
    boolean tryAcquire(OperationId opId);

    /**
     * 실행 성공 기록.
     *
     * <ul>
     *   <li>CLOSED: 실패 카운터 초기화</li>
     *   <li>HALF_OPEN: 연속 성공 카운터 증가, 시험 횟수 도달 시 CLOSED로 전이</li>
     * </ul>
     *
     * @param opId 호출 식별자 (null 허용)
     */
    void recordSuccess(OperationId opId);

    /**
     * 실행 실패 기록.
     *
     * <ul>
     *   <li>CLOSED: 실패 카운터 증가, 임계값 도달 시 OPEN으로 전이</li>
     *   <li>HALF_OPEN: 즉시 OPEN으로 전이</li>
     * </ul>
     *
     * @param opId 호출 식별자 (null 허용)
     * @param throwable 발생한 예외
     */
    void recordFailure(OperationId opId, Throwable throwable);

    /**
     * 현재 Circuit Breaker 상태 조회.
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * 카운터를 포함한 상태 스냅샷 조회.
     *
     * @return 스냅샷
     */
    CircuitSnapshot snapshot();

    /**
     * Circuit Breaker를 CLOSED 상태로 강제 리셋 (카운터 및 마지막 실패 시각 초기화).
     *
     * <p>수동 복구 또는 SEVERE 성능 저하 처리 시 사용됩니다.</p>
     */
    void reset();

    /**
     * Circuit Breaker를 통과시켜 작업 실행.
     *
     * <p>호출 시점에 요청이 차단되면 fallback을 실행하고, fallback이 없으면
     * {@link CircuitOpenException}을 던집니다. 작업 자체는 실행되지 않습니다.
     * 임계값에 도달시킨 호출은 fallback 대신 자신의 오류를 그대로 전파합니다.</p>
     *
     * @param opId 호출 식별자 (null 허용)
     * @param operation 실행할 작업
     * @param fallback 차단 시 실행할 대체 작업 (null 허용)
     * @param <T> 결과 타입
     * @return 작업 또는 fallback 결과
     * @throws Exception 작업 실패 또는 차단
     */
    default <T> T execute(OperationId opId, Callable<T> operation, Callable<T> fallback) throws Exception {
        if (!tryAcquire(opId)) {
            if (fallback != null) {
                return fallback.call();
            }
            throw new CircuitOpenException(getName(), snapshot());
        }

        T result;
        try {
            result = operation.call();
        } catch (Exception e) {
            recordFailure(opId, e);
            throw e;
        }
        recordSuccess(opId);
        return result;
    }
}
