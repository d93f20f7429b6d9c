package com.ryuqq.resilience.core.error;

/**
 * 외부 의존성 호출 실패.
 *
 * <p>작업 구현체가 자신의 실패에 {@link ErrorKind}를 직접 부여할 때 사용합니다.</p>
 *
 * <pre>{@code
 * if (response.status() == 503) {
 *     throw new DependencyException(ErrorKind.SERVICE_UNAVAILABLE, "gemini returned 503");
 * }
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DependencyException extends ResilienceException {

    public DependencyException(ErrorKind kind, String message) {
        super(kind, message);
    }

    public DependencyException(ErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }
}
