package com.ryuqq.resilience.core.error;

import com.ryuqq.resilience.core.model.OperationId;
import com.ryuqq.resilience.core.model.UserMessage;
import com.ryuqq.resilience.core.protection.CircuitSnapshot;

import java.util.Map;

/**
 * 재시도, Circuit Breaker, Fallback을 모두 거친 뒤에도 복구하지 못한 호출.
 *
 * <p>시스템 경계를 넘어가는 오류로, 의존성 이름과 Circuit 스냅샷, 사용자용 문구를 함께 담습니다.
 * {@link #getCause()}는 주 경로의 원래 오류이며, 실패한 Fallback들의 오류는
 * 원래 오류의 {@link Throwable#getSuppressed()}로 확인할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class OperationFailedException extends ResilienceException {

    private final String dependency;
    private final OperationId operationId;
    private final CircuitSnapshot circuitSnapshot;
    private final UserMessage userMessage;
    private final String language;
    private final Map<String, Object> context;

    public OperationFailedException(
        ErrorKind kind,
        String dependency,
        OperationId operationId,
        CircuitSnapshot circuitSnapshot,
        UserMessage userMessage,
        String language,
        Map<String, Object> context,
        Throwable cause
    ) {
        super(kind, dependency + " operation failed: " + (cause == null ? kind : cause.getMessage()), cause);
        this.dependency = dependency;
        this.operationId = operationId;
        this.circuitSnapshot = circuitSnapshot;
        this.userMessage = userMessage;
        this.language = language;
        this.context = context == null ? Map.of() : context;
    }

    public String getDependency() {
        return dependency;
    }

    /**
     * @return 호출 식별자 (Orchestrator를 거치지 않은 호출이면 null)
     */
    public OperationId getOperationId() {
        return operationId;
    }

    public CircuitSnapshot getCircuitSnapshot() {
        return circuitSnapshot;
    }

    public UserMessage getUserMessage() {
        return userMessage;
    }

    public String getLanguage() {
        return language;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    /**
     * 항상 false.
     */
    public boolean isSuccess() {
        return false;
    }

    /**
     * 항상 false. Fallback이 응답했다면 이 예외는 만들어지지 않습니다.
     */
    public boolean isFallbackUsed() {
        return false;
    }
}
