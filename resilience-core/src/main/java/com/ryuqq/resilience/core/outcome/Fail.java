package com.ryuqq.resilience.core.outcome;

import com.ryuqq.resilience.core.error.ErrorKind;

/**
 * 실패 결과.
 *
 * <p>작업에서 빠져나온 예외를 값으로 표현합니다.</p>
 *
 * @param kind 분류된 오류 종류
 * @param message 오류 메시지
 * @param cause 원본 예외
 * @param <T> 결과 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Fail<T>(
    ErrorKind kind,
    String message,
    Throwable cause
) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind 또는 cause가 null인 경우
     */
    public Fail {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
        if (message == null || message.isBlank()) {
            message = cause.getClass().getSimpleName();
        }
    }

    public static <T> Fail<T> of(ErrorKind kind, Throwable cause) {
        return new Fail<>(kind, cause.getMessage(), cause);
    }
}
