package com.ryuqq.resilience.core.error;

/**
 * 복원력 계층 예외의 공통 상위 타입.
 *
 * <p>모든 하위 예외는 {@link ErrorKind}를 가지며, 재시도 및 메시지 선택은 이 값을 기준으로 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ResilienceException extends RuntimeException {

    private final ErrorKind kind;

    public ResilienceException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public ResilienceException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
