package com.ryuqq.resilience.core.protection;

import java.util.Map;

/**
 * 주 경로 실패 시 시도하는 대체 전략.
 *
 * <p>Fallback 체인에 등록된 순서대로 실행되며, 처음으로 성공한 전략의 결과가 사용됩니다.</p>
 *
 * <pre>{@code
 * FallbackStrategy<Document> templateGeneration =
 *     (context, error) -> templates.render((ContractRequest) context.get("contractRequest"));
 * }</pre>
 *
 * @param <T> 결과 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FallbackStrategy<T> {

    /**
     * 대체 결과 생성.
     *
     * @param context 호출 컨텍스트 (읽기 전용)
     * @param precedingError 주 경로의 오류
     * @return 대체 결과
     * @throws Exception 이 전략도 실패한 경우
     */
    T recover(Map<String, Object> context, Throwable precedingError) throws Exception;
}
