package com.ryuqq.resilience.core.error;

/**
 * 오류 분류 태그.
 *
 * <p>오류가 만들어지는 지점에서 부여되며, 재시도 가능 여부는 이 열거형이 가진 데이터로 결정됩니다.</p>
 *
 * <table>
 *   <caption>재시도 가능 여부</caption>
 *   <tr><th>종류</th><th>재시도</th><th>비고</th></tr>
 *   <tr><td>TRANSIENT_NETWORK</td><td>O</td><td>connection reset / refused, host not found</td></tr>
 *   <tr><td>TIMEOUT</td><td>O</td><td>원래 호출은 취소되지 않음</td></tr>
 *   <tr><td>SERVICE_UNAVAILABLE</td><td>O</td><td>일시적 서비스 불가</td></tr>
 *   <tr><td>RATE_LIMITED</td><td>O</td><td>외부 API 호출 한도 초과</td></tr>
 *   <tr><td>CIRCUIT_OPEN</td><td>X</td><td>resetTimeout 경과 또는 Fallback 필요</td></tr>
 *   <tr><td>CAPACITY_EXCEEDED</td><td>X</td><td>Orchestrator 진입 거부</td></tr>
 *   <tr><td>CLIENT_VALIDATION</td><td>X</td><td>잘못된 입력</td></tr>
 *   <tr><td>UNKNOWN</td><td>X</td><td>기본값</td></tr>
 * </table>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ErrorKind {

    TRANSIENT_NETWORK(true),

    TIMEOUT(true),

    SERVICE_UNAVAILABLE(true),

    RATE_LIMITED(true),

    CIRCUIT_OPEN(false),

    CAPACITY_EXCEEDED(false),

    CLIENT_VALIDATION(false),

    UNKNOWN(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
