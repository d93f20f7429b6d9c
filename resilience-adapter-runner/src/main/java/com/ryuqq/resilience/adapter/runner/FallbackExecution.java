package com.ryuqq.resilience.adapter.runner;

/**
 * Fallback 체인 실행 결과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param value 결과값
 * @param fallbackUsed Fallback이 응답했는지 여부
 * @param fallbackIndex 응답한 Fallback의 위치 (주 경로면 -1)
 * @param primaryError 주 경로의 오류 (주 경로 성공 시 null)
 * @param <T> 결과 타입
 */
public record FallbackExecution<T>(
    T value,
    boolean fallbackUsed,
    int fallbackIndex,
    Throwable primaryError
) {

    public static <T> FallbackExecution<T> primary(T value) {
        return new FallbackExecution<>(value, false, -1, null);
    }

    public static <T> FallbackExecution<T> fallback(T value, int fallbackIndex, Throwable primaryError) {
        return new FallbackExecution<>(value, true, fallbackIndex, primaryError);
    }
}
