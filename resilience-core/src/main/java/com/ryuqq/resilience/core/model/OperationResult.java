package com.ryuqq.resilience.core.model;

import java.time.Instant;

/**
 * 성공한 호출의 결과.
 *
 * <p>주 경로가 성공했거나, 주 경로 실패 후 Fallback이 결과를 대신 만들어낸 경우를 모두 표현합니다.
 * Fallback이 응답한 경우 {@code fallbackUsed=true}이며 {@code originalError}에 주 경로의 오류 메시지가 남습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param data 결과 값 (null 허용)
 * @param dependency 의존성 이름
 * @param operationId 호출 식별자 (Orchestrator를 거치지 않은 경우 null)
 * @param timestamp 완료 시각
 * @param fallbackUsed Fallback 사용 여부
 * @param originalError Fallback 사용 시 주 경로 오류 메시지 (그 외 null)
 * @param <T> 결과 타입
 */
public record OperationResult<T>(
    T data,
    String dependency,
    OperationId operationId,
    Instant timestamp,
    boolean fallbackUsed,
    String originalError
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException dependency 또는 timestamp가 null인 경우
     */
    public OperationResult {
        if (dependency == null || dependency.isBlank()) {
            throw new IllegalArgumentException("dependency cannot be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
    }

    public static <T> OperationResult<T> primary(T data, String dependency, OperationId operationId, Instant timestamp) {
        return new OperationResult<>(data, dependency, operationId, timestamp, false, null);
    }

    public static <T> OperationResult<T> fallback(T data, String dependency, OperationId operationId,
                                                  Instant timestamp, String originalError) {
        return new OperationResult<>(data, dependency, operationId, timestamp, true, originalError);
    }

    /**
     * 항상 true. 실패는 예외로 전달됩니다.
     */
    public boolean success() {
        return true;
    }
}
