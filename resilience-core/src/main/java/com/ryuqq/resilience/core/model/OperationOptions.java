package com.ryuqq.resilience.core.model;

import com.ryuqq.resilience.core.protection.FallbackStrategy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 단일 호출 옵션 (불변 record).
 *
 * <p>의존성 설정을 호출 단위로 덮어쓰거나, 사용자 메시지 포맷팅에 쓰일 부가 정보를 전달합니다.</p>
 *
 * <ul>
 *   <li>timeoutMs: 이 호출에만 적용할 타임아웃 (null이면 의존성의 작업용 설정 사용)</li>
 *   <li>retryable: false이면 재시도 없이 1회만 시도 (멱등하지 않은 작업용)</li>
 *   <li>fallback: 등록된 Fallback 체인이 모두 실패한 뒤 시도할 호출 단위 대체 전략</li>
 *   <li>language: 사용자 메시지 언어 태그 (null이면 기본 언어)</li>
 *   <li>operationName: 로그 및 오류 컨텍스트용 작업 이름</li>
 *   <li>context: Fallback 전략과 오류 컨텍스트에 전달되는 자유 형식 값</li>
 * </ul>
 *
 * <p><strong>주의:</strong> fallback은 호출한 작업과 같은 결과 타입을 반환해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param timeoutMs 타임아웃 덮어쓰기 (밀리초, null 허용)
 * @param retryable 재시도 허용 여부
 * @param fallback 호출 단위 Fallback (null 허용)
 * @param language 언어 태그 (null 허용)
 * @param operationName 작업 이름 (null이면 "unknown")
 * @param context 자유 형식 컨텍스트 (null이면 빈 Map)
 */
public record OperationOptions(
    Long timeoutMs,
    boolean retryable,
    FallbackStrategy<?> fallback,
    String language,
    String operationName,
    Map<String, Object> context
) {

    private static final String UNKNOWN_OPERATION = "unknown";

    /**
     * 기본 옵션 생성자.
     *
     * <p>기본값: 의존성 타임아웃 사용, 재시도 허용, Fallback 없음, 기본 언어</p>
     */
    public OperationOptions() {
        this(null, true, null, null, UNKNOWN_OPERATION, Map.of());
    }

    /**
     * Compact constructor (유효성 검증 및 정규화).
     *
     * @throws IllegalArgumentException timeoutMs가 음수인 경우
     */
    public OperationOptions {
        if (timeoutMs != null && timeoutMs < 0) {
            throw new IllegalArgumentException(
                "timeoutMs must be non-negative (current: " + timeoutMs + ")"
            );
        }
        if (operationName == null || operationName.isBlank()) {
            operationName = UNKNOWN_OPERATION;
        }
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static OperationOptions defaults() {
        return new OperationOptions();
    }

    public OperationOptions withTimeoutMs(long timeoutMs) {
        return new OperationOptions(timeoutMs, retryable, fallback, language, operationName, context);
    }

    /**
     * 재시도를 끈 사본 생성 (멱등하지 않은 작업용).
     */
    public OperationOptions withoutRetry() {
        return new OperationOptions(timeoutMs, false, fallback, language, operationName, context);
    }

    public OperationOptions withFallback(FallbackStrategy<?> fallback) {
        return new OperationOptions(timeoutMs, retryable, fallback, language, operationName, context);
    }

    public OperationOptions withLanguage(String language) {
        return new OperationOptions(timeoutMs, retryable, fallback, language, operationName, context);
    }

    public OperationOptions withOperationName(String operationName) {
        return new OperationOptions(timeoutMs, retryable, fallback, language, operationName, context);
    }

    public OperationOptions withContext(Map<String, Object> context) {
        return new OperationOptions(timeoutMs, retryable, fallback, language, operationName, context);
    }
}
