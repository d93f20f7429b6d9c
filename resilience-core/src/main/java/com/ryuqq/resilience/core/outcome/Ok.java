package com.ryuqq.resilience.core.outcome;

/**
 * 성공 결과.
 *
 * @param value 작업 반환값 (null 가능)
 * @param <T> 결과 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Ok<T>(T value) implements Outcome<T> {

    public static <T> Ok<T> of(T value) {
        return new Ok<>(value);
    }
}
