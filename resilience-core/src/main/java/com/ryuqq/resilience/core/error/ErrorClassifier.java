package com.ryuqq.resilience.core.error;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * 예외를 {@link ErrorKind}로 분류.
 *
 * <p>예외 타입으로 먼저 판정합니다. 원인(cause) 체인을 따라가며
 * 처음으로 분류 가능한 예외의 결과를 사용합니다. 타입으로 분류되지 않으면
 * 마지막으로 메시지에 포함된 표지어("timeout", "network", "rate limit" 등)를 확인합니다.</p>
 *
 * <ul>
 *   <li>{@link ResilienceException}: 부여된 kind</li>
 *   <li>{@link SocketTimeoutException}, {@link TimeoutException}: TIMEOUT</li>
 *   <li>{@link ConnectException}, {@link UnknownHostException}, {@link NoRouteToHostException},
 *       그 외 {@link SocketException}: TRANSIENT_NETWORK</li>
 *   <li>{@link IllegalArgumentException}: CLIENT_VALIDATION</li>
 *   <li>메시지 표지어: "timeout" → TIMEOUT, "rate limit" → RATE_LIMITED,
 *       "unavailable"/"temporary" → SERVICE_UNAVAILABLE, "network"/"connection" → TRANSIENT_NETWORK</li>
 *   <li>그 외: UNKNOWN</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 16;

    private ErrorClassifier() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 예외 분류.
     *
     * @param error 분류할 예외 (null이면 UNKNOWN)
     * @return 분류 결과
     */
    public static ErrorKind classify(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < MAX_CAUSE_DEPTH) {
            ErrorKind kind = classifySingle(current);
            if (kind != null) {
                return kind;
            }
            current = current.getCause();
            depth++;
        }
        return classifyByMessage(error);
    }

    /**
     * 재시도 가능 여부.
     *
     * @param error 예외
     * @return 분류 결과가 재시도 가능한 종류이면 true
     */
    public static boolean isRetryable(Throwable error) {
        return classify(error).isRetryable();
    }

    private static ErrorKind classifySingle(Throwable error) {
        if (error instanceof ResilienceException resilience) {
            return resilience.getKind();
        }
        // 래퍼 예외는 원인으로 위임
        if (error instanceof ExecutionException || error instanceof CompletionException) {
            return null;
        }
        if (error instanceof SocketTimeoutException || error instanceof TimeoutException) {
            return ErrorKind.TIMEOUT;
        }
        if (error instanceof ConnectException
            || error instanceof UnknownHostException
            || error instanceof NoRouteToHostException
            || error instanceof SocketException) {
            return ErrorKind.TRANSIENT_NETWORK;
        }
        if (error instanceof IllegalArgumentException) {
            return ErrorKind.CLIENT_VALIDATION;
        }
        return null;
    }

    private static ErrorKind classifyByMessage(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < MAX_CAUSE_DEPTH) {
            String message = current.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                if (lower.contains("timeout") || lower.contains("timed out")) {
                    return ErrorKind.TIMEOUT;
                }
                if (lower.contains("rate limit")) {
                    return ErrorKind.RATE_LIMITED;
                }
                if (lower.contains("unavailable") || lower.contains("temporary")) {
                    return ErrorKind.SERVICE_UNAVAILABLE;
                }
                if (lower.contains("network") || lower.contains("connection")) {
                    return ErrorKind.TRANSIENT_NETWORK;
                }
            }
            current = current.getCause();
            depth++;
        }
        return ErrorKind.UNKNOWN;
    }
}
