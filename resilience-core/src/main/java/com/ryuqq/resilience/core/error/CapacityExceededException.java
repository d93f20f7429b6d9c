package com.ryuqq.resilience.core.error;

import com.ryuqq.resilience.core.model.UserMessage;

/**
 * 동시 작업 한도 초과로 진입이 거부됨.
 *
 * <p>의존성의 재시도/Circuit Breaker 경로에 도달하기 전에 발생하며, 작업은 실행되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CapacityExceededException extends ResilienceException {

    private final String dependency;
    private final int activeOperations;
    private final int maxConcurrentOperations;
    private final UserMessage userMessage;

    public CapacityExceededException(String dependency, int activeOperations,
                                     int maxConcurrentOperations, UserMessage userMessage) {
        super(ErrorKind.CAPACITY_EXCEEDED,
            "System at capacity - too many concurrent operations (active: "
                + activeOperations + ", max: " + maxConcurrentOperations + ")");
        this.dependency = dependency;
        this.activeOperations = activeOperations;
        this.maxConcurrentOperations = maxConcurrentOperations;
        this.userMessage = userMessage;
    }

    public String getDependency() {
        return dependency;
    }

    public int getActiveOperations() {
        return activeOperations;
    }

    public int getMaxConcurrentOperations() {
        return maxConcurrentOperations;
    }

    public UserMessage getUserMessage() {
        return userMessage;
    }
}
