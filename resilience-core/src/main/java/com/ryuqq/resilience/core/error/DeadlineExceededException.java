package com.ryuqq.resilience.core.error;

/**
 * 작업이 제한 시간 내에 끝나지 않음.
 *
 * <p>제한 시간이 지나도 원래 작업은 취소되지 않고 계속 실행될 수 있으며, 그 결과는 버려집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DeadlineExceededException extends ResilienceException {

    private final long timeoutMs;

    public DeadlineExceededException(long timeoutMs) {
        this(timeoutMs, "Operation timed out after " + timeoutMs + "ms");
    }

    public DeadlineExceededException(long timeoutMs, String message) {
        super(ErrorKind.TIMEOUT, message);
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
