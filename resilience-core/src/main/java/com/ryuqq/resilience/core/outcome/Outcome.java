package com.ryuqq.resilience.core.outcome;

/**
 * 최상위 작업 실행 결과.
 *
 * <p>Outcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 작업이 값을 반환하며 완료됨</li>
 *   <li>{@link Fail}: 작업이 예외로 종료됨 (예외는 값으로 변환됨)</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * <pre>{@code
 * Outcome<Report> outcome = boundary.run(job::execute);
 * if (outcome instanceof Fail<Report> fail) {
 *     log.warn("job failed: {}", fail.message());
 * }
 * }</pre>
 *
 * @param <T> 결과 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Outcome<T> permits Ok, Fail {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
